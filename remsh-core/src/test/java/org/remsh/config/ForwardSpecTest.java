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
package org.remsh.config;

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.util.test.BaseTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestMethodOrder(MethodName.class)
public class ForwardSpecTest extends BaseTestSupport {
    public ForwardSpecTest() {
        super();
    }

    @Test
    void parseValidSpec() throws Exception {
        ForwardSpec spec = ForwardSpec.parse("8080:db.internal:5432");
        assertEquals(8080, spec.getLocalPort(), "local port");
        assertEquals("db.internal", spec.getRemoteHost(), "remote host");
        assertEquals(5432, spec.getRemotePort(), "remote port");
        assertEquals("8080:db.internal:5432", spec.toString());
        assertEquals(new ForwardSpec(8080, "db.internal", 5432), spec);
    }

    @Test
    void parseRejectsMalformedSpecs() {
        String[] specs = {
            null, "", "   ", "8080", "8080:host", "8080:host:80:90", "abc:host:80", "8080::80", "0:host:80",
            "8080:host:65536", "-1:host:80", "8080:host:"
        };
        for (String s : specs) {
            RemshException e = assertThrows(RemshException.class, () -> ForwardSpec.parse(s), "Accepted: " + s);
            assertEquals(FailureKind.FORWARD_SPEC_INVALID, e.getKind(), "Mismatched kind for " + s);
        }
    }

    @Test
    void parseAcceptsPortBoundaries() throws Exception {
        ForwardSpec spec = ForwardSpec.parse("1:localhost:65535");
        assertEquals(1, spec.getLocalPort());
        assertEquals(ForwardSpec.MAX_PORT, spec.getRemotePort());
    }
}
