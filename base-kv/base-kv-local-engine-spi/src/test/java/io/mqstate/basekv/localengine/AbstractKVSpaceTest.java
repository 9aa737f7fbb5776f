/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.mqstate.basekv.localengine;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import org.slf4j.LoggerFactory;
import org.testng.annotations.Test;

public class AbstractKVSpaceTest {
    private static class TestKVSpace extends AbstractKVSpace {
        private final IKVSpaceReader reader = mock(IKVSpaceReader.class);
        private int openFailures;
        private int closed;

        TestKVSpace(int openFailures) {
            super("test", LoggerFactory.getLogger(TestKVSpace.class));
            this.openFailures = openFailures;
        }

        @Override
        protected void doOpen() {
            if (openFailures > 0) {
                openFailures--;
                throw new KVSpaceLockedException("locked", null);
            }
        }

        @Override
        protected void doClose() {
            closed++;
        }

        @Override
        protected long doSize() {
            return 0;
        }

        @Override
        protected IKVSpaceReader doReader() {
            return reader;
        }

        @Override
        protected IKVSpaceWriter doWriter() {
            return mock(IKVSpaceWriter.class);
        }
    }

    @Test
    public void notOpened() {
        TestKVSpace space = new TestKVSpace(0);
        assertFalse(space.isOpen());
        assertThrows(KVEngineException.class, space::reader);
        assertThrows(KVEngineException.class, space::writer);
        assertThrows(KVEngineException.class, space::size);
    }

    @Test
    public void retryAfterFailedOpen() {
        TestKVSpace space = new TestKVSpace(1);
        assertThrows(KVSpaceLockedException.class, space::open);
        assertFalse(space.isOpen());
        space.open();
        assertTrue(space.isOpen());
        space.close();
    }

    @Test
    public void readerDelegates() {
        TestKVSpace space = new TestKVSpace(0);
        space.open();
        IKVSpaceReader reader = space.reader();
        reader.close();
        verify(space.reader).close();
        space.close();
    }

    @Test
    public void closeOnce() {
        TestKVSpace space = new TestKVSpace(0);
        space.open();
        space.open();
        space.close();
        space.close();
        assertFalse(space.isOpen());
        assertEquals(space.closed, 1);
        assertThrows(KVEngineException.class, space::reader);
    }
}
