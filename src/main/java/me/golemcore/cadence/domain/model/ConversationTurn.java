package me.golemcore.cadence.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Value;

/**
 * One entry of planner conversation history.
 */
@Value
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    String role;
    String content;

    public static ConversationTurn user(String content) {
        return new ConversationTurn(ROLE_USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(ROLE_ASSISTANT, content);
    }

    public boolean isUser() {
        return ROLE_USER.equals(role);
    }
}
