/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.store;

import io.github.proxgraph.quantization.VectorCompressor;
import io.github.proxgraph.vector.types.ByteSequence;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * A trained codebook and the version it was installed under.
 */
public final class CodebookRecord {
    private final long version;
    private final VectorCompressor<ByteSequence<?>> compressor;

    public CodebookRecord(long version, VectorCompressor<ByteSequence<?>> compressor) {
        this.version = version;
        this.compressor = compressor;
    }

    public long getVersion() {
        return version;
    }

    public VectorCompressor<ByteSequence<?>> getCompressor() {
        return compressor;
    }

    public void write(DataOutput out) throws IOException {
        out.writeLong(version);
        compressor.write(out);
    }

    public static CodebookRecord read(DataInput in) throws IOException {
        long version = in.readLong();
        return new CodebookRecord(version, VectorCompressor.read(in));
    }

    @Override
    public String toString() {
        return "CodebookRecord(version=" + version + ", " + compressor + ")";
    }
}
