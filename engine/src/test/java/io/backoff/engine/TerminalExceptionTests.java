/**
 * Copyright Backoff Authors.
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
 */
package io.backoff.engine;

import io.backoff.test.common.IntentionalException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

/**
 * Unit tests for the TerminalException class and the classification of attempt outcomes.
 */
public class TerminalExceptionTests {

    @Test
    public void testWrapAndUnwrap() {
        val cause = new IOException("permanent");
        val ex = TerminalException.of(cause);
        Assert.assertSame("Unexpected cause.", cause, ex.getCause());
        Assert.assertSame("Unexpected cause.", cause, Backoff.stop(cause).getCause());
        Assert.assertEquals("Unexpected message.", cause.toString(), ex.getMessage());
        Assert.assertEquals("TerminalException should not capture its own stack trace.", 0, ex.getStackTrace().length);
    }

    @Test(expected = NullPointerException.class)
    public void testNullCause() {
        TerminalException.of(null);
    }

    @Test
    public void testClassify() {
        Assert.assertEquals(Outcome.SUCCESS, Outcome.classify(null));
        Assert.assertEquals(Outcome.RETRYABLE, Outcome.classify(new IntentionalException()));
        Assert.assertEquals(Outcome.RETRYABLE, Outcome.classify(new CompletionException(new IOException())));

        val cause = new IOException("permanent");
        val terminal = TerminalException.of(cause);
        Assert.assertEquals(Outcome.TERMINAL, Outcome.classify(terminal));
        Assert.assertEquals(Outcome.TERMINAL, Outcome.classify(new IllegalStateException("wrapper", terminal)));
        Assert.assertEquals(Outcome.TERMINAL, Outcome.classify(new CompletionException(terminal)));
        Assert.assertSame(terminal, Outcome.findTerminal(new RuntimeException(new CompletionException(terminal))));
        Assert.assertNull(Outcome.findTerminal(new IntentionalException()));
    }
}
