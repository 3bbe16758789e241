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
package org.remsh.terminal;

import org.apache.sshd.common.channel.SttySupport;

/**
 * A (rows, columns) pair
 */
public final class TerminalSize {
    public static final TerminalSize DEFAULT
            = new TerminalSize(SttySupport.DEFAULT_TERMINAL_HEIGHT, SttySupport.DEFAULT_TERMINAL_WIDTH);

    private final int rows;
    private final int columns;

    public TerminalSize(int rows, int columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    @Override
    public int hashCode() {
        return 31 * rows + columns;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        TerminalSize other = (TerminalSize) obj;
        return (rows == other.rows) && (columns == other.columns);
    }

    @Override
    public String toString() {
        return columns + "x" + rows;
    }
}
