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

import com.google.protobuf.ByteString;
import io.micrometer.core.instrument.Tags;
import io.mqstate.basekv.localengine.metrics.KVSpaceOpMeters;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

/**
 * Base implementation of IKVSpace which drives the open/close state machine and records operation metrics.
 */
public abstract class AbstractKVSpace implements IKVSpace {
    protected final String id;
    protected final Logger logger;
    protected final Tags tags;
    private final AtomicReference<State> state;
    private KVSpaceOpMeters opMeters;

    public AbstractKVSpace(String id, Logger logger, String... tags) {
        this.id = id;
        this.logger = logger;
        this.tags = Tags.of(tags);
        state = new AtomicReference<>(State.Init);
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final void open() {
        if (state.compareAndSet(State.Init, State.Opening)) {
            try {
                doOpen();
                opMeters = new KVSpaceOpMeters(id, tags);
                state.set(State.Opened);
            } catch (Throwable e) {
                // allow the owner to retry
                state.set(State.Init);
                throw e;
            }
        }
    }

    @Override
    public final boolean isOpen() {
        return state.get() == State.Opened;
    }

    @Override
    public final long size() {
        checkOpened();
        return opMeters.sizeCallTimer.record(this::doSize);
    }

    @Override
    public final IKVSpaceReader reader() {
        checkOpened();
        return new MonitoredReader(opMeters.readerNewCallTimer.record(this::doReader));
    }

    @Override
    public final IKVSpaceWriter writer() {
        checkOpened();
        return new MonitoredWriter(doWriter());
    }

    @Override
    public final void close() {
        if (state.compareAndSet(State.Opened, State.Closing)) {
            try {
                doClose();
            } finally {
                opMeters.close();
                state.set(State.Closed);
            }
        }
    }

    protected abstract void doOpen();

    protected abstract void doClose();

    protected abstract long doSize();

    protected abstract IKVSpaceReader doReader();

    protected abstract IKVSpaceWriter doWriter();

    private void checkOpened() {
        if (state.get() != State.Opened) {
            throw new KVEngineException("KVSpace[" + id + "] is not opened: state=" + state.get());
        }
    }

    private enum State {
        Init, Opening, Opened, Closing, Closed
    }

    private class MonitoredReader implements IKVSpaceReader {
        private final IKVSpaceReader delegate;

        private MonitoredReader(IKVSpaceReader delegate) {
            this.delegate = delegate;
        }

        @Override
        public String id() {
            return delegate.id();
        }

        @Override
        public boolean exist(ByteString key) {
            return opMeters.existCallTimer.record(() -> delegate.exist(key));
        }

        @Override
        public Optional<ByteString> get(ByteString key) {
            return opMeters.getCallTimer.record(() -> delegate.get(key).map(v -> {
                opMeters.readBytesSummary.record(v.size());
                return v;
            }));
        }

        @Override
        public IKVSpaceIterator newIterator(ByteString prefix) {
            return opMeters.iterNewCallTimer.record(() -> delegate.newIterator(prefix));
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    private class MonitoredWriter implements IKVSpaceWriter {
        private final IKVSpaceWriter delegate;

        private MonitoredWriter(IKVSpaceWriter delegate) {
            this.delegate = delegate;
        }

        @Override
        public String id() {
            return delegate.id();
        }

        @Override
        public IKVSpaceWriter put(ByteString key, ByteString value) {
            delegate.put(key, value);
            return this;
        }

        @Override
        public IKVSpaceWriter delete(ByteString key) {
            delegate.delete(key);
            return this;
        }

        @Override
        public void done() {
            opMeters.batchWriteCallTimer.record(() -> {
                opMeters.writeBatchSizeSummary.record(delegate.count());
                delegate.done();
            });
        }

        @Override
        public void abort() {
            delegate.abort();
        }

        @Override
        public int count() {
            return delegate.count();
        }
    }
}
