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
package org.remsh.cli;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.Objects;

import org.remsh.trust.HostKeyPrompt;

/**
 * Asks on the error stream and reads the answer from the local input. The answer is read one byte at a time up to the
 * end of the line, so nothing typed after it is taken away from the session.
 */
public class ConsoleHostKeyPrompt implements HostKeyPrompt {
    private final InputStream input;
    private final PrintStream output;

    public ConsoleHostKeyPrompt(InputStream input, PrintStream output) {
        this.input = Objects.requireNonNull(input, "No input");
        this.output = Objects.requireNonNull(output, "No output");
    }

    @Override
    public boolean isInteractive() {
        return true;
    }

    @Override
    public String readLine(String prompt) throws IOException {
        synchronized (output) {
            output.print(prompt);
            output.flush();
        }

        ByteArrayOutputStream line = new ByteArrayOutputStream();
        for (int c = input.read(); c != '\n'; c = input.read()) {
            if (c < 0) {
                if (line.size() <= 0) {
                    throw new EOFException("No answer before end of input");
                }
                break;
            }
            if (c != '\r') {
                line.write(c);
            }
        }
        return new String(line.toByteArray(), Charset.defaultCharset());
    }
}
