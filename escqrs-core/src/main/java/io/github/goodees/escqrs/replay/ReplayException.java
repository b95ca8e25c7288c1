package io.github.goodees.escqrs.replay;

/*-
 * #%L
 * escqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

/**
 * Replay does not exist, or cannot make requested state change.
 */
public class ReplayException extends RuntimeException {
    private final String replayId;

    public ReplayException(String replayId, String message, Throwable cause) {
        super(message, cause);
        this.replayId = replayId;
    }

    public ReplayException(String replayId, String message) {
        this(replayId, message, null);
    }

    public String getReplayId() {
        return replayId;
    }

    static ReplayException notFound(String replayId) {
        return new ReplayException(replayId, "Replay not found: " + replayId);
    }

    static ReplayException illegalState(String replayId, String action, ReplayStatus status) {
        return new ReplayException(replayId, "Cannot " + action + " replay " + replayId + " in status " + status);
    }

    static ReplayException stopped(String replayId, ReplayError error, Throwable cause) {
        return new ReplayException(replayId, "Replay " + replayId + " stopped at position " + error.getPosition()
                + ": " + error.getMessage(), cause);
    }
}
