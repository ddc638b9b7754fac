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

import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the vector table: the full-precision vector stored under a caller-assigned id, the graph
 * ordinal it was given, its metadata, and optionally its quantized code tagged with the codebook version
 * that produced it.
 * <p>
 * Records are immutable; a tombstone or a new code is written as a modified copy.
 */
public final class VectorRecord {
    private static final int FORMAT_VERSION = 1;

    /** codeVersion of a record that carries no code */
    public static final long NO_CODE = -1;

    private final long id;
    private final int ordinal;
    private final VectorFloat<?> vector;
    private final Map<String, String> metadata;
    private final boolean deleted;
    private final long codeVersion;
    private final ByteSequence<?> code;

    public VectorRecord(long id, int ordinal, VectorFloat<?> vector, Map<String, String> metadata) {
        this(id, ordinal, vector, metadata, false, NO_CODE, null);
    }

    private VectorRecord(long id, int ordinal, VectorFloat<?> vector, Map<String, String> metadata,
                         boolean deleted, long codeVersion, ByteSequence<?> code) {
        if (vector == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        this.id = id;
        this.ordinal = ordinal;
        this.vector = vector;
        this.metadata = metadata == null || metadata.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.deleted = deleted;
        this.codeVersion = code == null ? NO_CODE : codeVersion;
        this.code = code;
    }

    public long getId() {
        return id;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public VectorFloat<?> getVector() {
        return vector;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * @return the version of the codebook that produced {@link #getCode()}, or {@link #NO_CODE}
     */
    public long getCodeVersion() {
        return codeVersion;
    }

    /**
     * @return the quantized code, or null
     */
    public ByteSequence<?> getCode() {
        return code;
    }

    public VectorRecord asDeleted() {
        return new VectorRecord(id, ordinal, vector, metadata, true, codeVersion, code);
    }

    public VectorRecord withCode(long version, ByteSequence<?> newCode) {
        return new VectorRecord(id, ordinal, vector, metadata, deleted, version, newCode);
    }

    public void write(DataOutput out, VectorTypeSupport vts) throws IOException {
        out.writeByte(FORMAT_VERSION);
        out.writeLong(id);
        out.writeInt(ordinal);
        out.writeBoolean(deleted);
        out.writeInt(vector.length());
        vts.writeFloatVector(out, vector);
        out.writeInt(metadata.size());
        for (var e : metadata.entrySet()) {
            out.writeUTF(e.getKey());
            out.writeUTF(e.getValue());
        }
        out.writeLong(codeVersion);
        if (code == null) {
            out.writeInt(-1);
        } else {
            out.writeInt(code.length());
            vts.writeByteSequence(out, code);
        }
    }

    public static VectorRecord read(DataInput in, VectorTypeSupport vts) throws IOException {
        int format = in.readByte();
        if (format != FORMAT_VERSION) {
            throw new IOException("Unsupported vector record format " + format);
        }
        long id = in.readLong();
        int ordinal = in.readInt();
        boolean deleted = in.readBoolean();
        int dimension = in.readInt();
        var vector = vts.readFloatVector(in, dimension);
        int metadataCount = in.readInt();
        var metadata = new LinkedHashMap<String, String>();
        for (int i = 0; i < metadataCount; i++) {
            metadata.put(in.readUTF(), in.readUTF());
        }
        long codeVersion = in.readLong();
        int codeLength = in.readInt();
        ByteSequence<?> code = codeLength < 0 ? null : vts.readByteSequence(in, codeLength);
        return new VectorRecord(id, ordinal, vector, metadata, deleted, codeVersion, code);
    }

    @Override
    public String toString() {
        return String.format("VectorRecord(id=%d, ordinal=%d, dimension=%d, deleted=%s, codeVersion=%d)",
                             id, ordinal, vector.length(), deleted, codeVersion);
    }
}
