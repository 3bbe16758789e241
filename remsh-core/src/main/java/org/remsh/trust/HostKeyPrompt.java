/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.remsh.trust;

import java.io.IOException;

/**
 * Asks the user to confirm an unknown host key
 */
public interface HostKeyPrompt {
    /** Used when no controlling terminal is attached */
    HostKeyPrompt NON_INTERACTIVE = new HostKeyPrompt() {
        @Override
        public boolean isInteractive() {
            return false;
        }

        @Override
        public String readLine(String prompt) throws IOException {
            throw new IOException("Not interactive");
        }
    };

    /**
     * @return {@code true} if the controlling input is an interactive terminal
     */
    boolean isInteractive();

    /**
     * @param  prompt      Text shown before reading
     * @return             The answer - {@code null} on end of input
     * @throws IOException If failed to read
     */
    String readLine(String prompt) throws IOException;
}
