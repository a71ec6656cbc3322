/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */


package com.example.s2s.devicebridge.directory;

/**
 * The character a user has selected: which provider speaks, with which
 * upstream voice/agent/config, and the prompts that shape it.
 */
public final class Personality {
    private final String key;
    private final String provider;
    private final String voice;
    private final String title;
    private final String characterPrompt;
    private final String voicePrompt;
    private final String firstMessagePrompt;
    private final double pitchFactor;

    public Personality(String key, String provider, String voice, String title, String characterPrompt,
                       String voicePrompt, String firstMessagePrompt, double pitchFactor) {
        this.key = key;
        this.provider = provider;
        this.voice = voice;
        this.title = title;
        this.characterPrompt = characterPrompt;
        this.voicePrompt = voicePrompt;
        this.firstMessagePrompt = firstMessagePrompt;
        this.pitchFactor = pitchFactor;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return provider tag, resolved through the provider registry
     */
    public String getProvider() {
        return provider;
    }

    /**
     * @return upstream resource for this character: voice, agent id or config id
     */
    public String getVoice() {
        return voice;
    }

    public String getTitle() {
        return title;
    }

    public String getCharacterPrompt() {
        return characterPrompt;
    }

    public String getVoicePrompt() {
        return voicePrompt;
    }

    public String getFirstMessagePrompt() {
        return firstMessagePrompt;
    }

    public double getPitchFactor() {
        return pitchFactor;
    }

    @Override
    public String toString() {
        return "Personality{key='" + key + "', provider='" + provider + "', voice='" + voice + "'}";
    }
}
