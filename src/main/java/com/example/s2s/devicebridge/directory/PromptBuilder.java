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
 * Builds the system context and opening line for a session from the user's
 * personality, name and language.
 */
public class PromptBuilder {

    private final String fallbackSystemPrompt;

    public PromptBuilder(String fallbackSystemPrompt) {
        this.fallbackSystemPrompt = fallbackSystemPrompt;
    }

    public String systemContext(UserRecord user) {
        Personality personality = user.getPersonality();
        StringBuilder sb = new StringBuilder();
        if (personality != null && hasText(personality.getCharacterPrompt())) {
            sb.append(personality.getCharacterPrompt().trim());
        } else {
            sb.append(fallbackSystemPrompt);
        }
        if (personality != null && hasText(personality.getVoicePrompt())) {
            sb.append("\n\nVoice: ").append(personality.getVoicePrompt().trim());
        }
        if (hasText(user.getDisplayName())) {
            sb.append("\n\nYou are talking with ").append(user.getDisplayName().trim()).append('.');
        }
        sb.append("\nRespond in the language with code ").append(user.getLanguageCode())
            .append(". Keep answers short; they are spoken aloud on a small speaker.");
        return sb.toString();
    }

    /**
     * @return what the assistant should answer first, never null
     */
    public String firstMessage(UserRecord user) {
        Personality personality = user.getPersonality();
        if (personality != null && hasText(personality.getFirstMessagePrompt())) {
            return personality.getFirstMessagePrompt().trim();
        }
        if (hasText(user.getDisplayName())) {
            return "Greet " + user.getDisplayName().trim() + " warmly and ask how they are doing.";
        }
        return "Greet the user warmly and ask how they are doing.";
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
