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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded planner history owned by one coordinator session. Appending beyond
 * the cap drops the oldest turns.
 */
public class ConversationHistory {

    private final int maxTurns;
    private final Deque<ConversationTurn> turns = new ArrayDeque<>();

    public ConversationHistory(int maxTurns) {
        if (maxTurns < 2) {
            throw new IllegalArgumentException("History must hold at least one exchange");
        }
        this.maxTurns = maxTurns;
    }

    public synchronized void append(ConversationTurn turn) {
        turns.addLast(turn);
        while (turns.size() > maxTurns) {
            turns.removeFirst();
        }
    }

    public synchronized void appendExchange(String userContent, String assistantContent) {
        append(ConversationTurn.user(userContent));
        append(ConversationTurn.assistant(assistantContent));
    }

    public synchronized List<ConversationTurn> getTurns() {
        return List.copyOf(turns);
    }

    public synchronized int size() {
        return turns.size();
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public synchronized void clear() {
        turns.clear();
    }
}
