/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tally.testutils.common;

import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;

/** Logs the start and the outcome of every test, registered through extension auto-detection. */
public class TestLoggerExtension implements TestWatcher, BeforeEachCallback {

    private static final Logger LOG = LoggerFactory.getLogger(TestLoggerExtension.class);

    private static final String SEPARATOR =
            "================================================================================";
    private static final String DIVIDER =
            "--------------------------------------------------------------------------------";

    @Override
    public void beforeEach(ExtensionContext context) {
        LOG.info(
                "\n{}\nTest {}.{}[{}] is running.\n{}",
                SEPARATOR,
                context.getRequiredTestClass().getCanonicalName(),
                context.getRequiredTestMethod().getName(),
                context.getDisplayName(),
                DIVIDER);
    }

    @Override
    public void testSuccessful(ExtensionContext context) {
        LOG.info(
                "\n{}\nTest {}.{}[{}] successfully run.\n{}\n",
                DIVIDER,
                context.getRequiredTestClass().getCanonicalName(),
                context.getRequiredTestMethod().getName(),
                context.getDisplayName(),
                SEPARATOR);
    }

    @Override
    public void testFailed(ExtensionContext context, Throwable cause) {
        LOG.error(
                "\n{}\nTest {}.{}[{}] failed with:\n{}\n{}\n",
                DIVIDER,
                context.getRequiredTestClass().getCanonicalName(),
                context.getRequiredTestMethod().getName(),
                context.getDisplayName(),
                stackTraceOf(cause),
                SEPARATOR);
    }

    private static String stackTraceOf(Throwable t) {
        if (t == null) {
            return "(null)";
        }
        StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            t.printStackTrace(writer);
        }
        return out.toString();
    }
}
