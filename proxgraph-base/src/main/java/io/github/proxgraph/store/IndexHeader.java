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

import io.github.proxgraph.quantization.QuantizerConfig;
import io.github.proxgraph.vector.VectorSimilarityFunction;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;

/**
 * The header record of a persisted index: everything needed to interpret the node table, vector table and
 * codebook.
 */
public final class IndexHeader {
    static final int MAGIC = 0x50584752; // "PXGR"
    static final int FORMAT_VERSION = 1;

    private final int dimension;
    private final VectorSimilarityFunction similarityFunction;
    private final int maxDegree;
    private final int efConstruction;
    private final QuantizerConfig quantizerConfig;
    private final long codebookVersion;
    private final int nextOrdinal;

    public IndexHeader(int dimension, VectorSimilarityFunction similarityFunction, int maxDegree, int efConstruction,
                       QuantizerConfig quantizerConfig, long codebookVersion, int nextOrdinal) {
        this.dimension = dimension;
        this.similarityFunction = similarityFunction;
        this.maxDegree = maxDegree;
        this.efConstruction = efConstruction;
        this.quantizerConfig = quantizerConfig;
        this.codebookVersion = codebookVersion;
        this.nextOrdinal = nextOrdinal;
    }

    public int getDimension() {
        return dimension;
    }

    public VectorSimilarityFunction getSimilarityFunction() {
        return similarityFunction;
    }

    public int getMaxDegree() {
        return maxDegree;
    }

    public int getEfConstruction() {
        return efConstruction;
    }

    public QuantizerConfig getQuantizerConfig() {
        return quantizerConfig;
    }

    /**
     * @return the version of the installed codebook, or 0 if none has been trained
     */
    public long getCodebookVersion() {
        return codebookVersion;
    }

    /**
     * @return the ordinal the next inserted vector would receive when this header was written
     */
    public int getNextOrdinal() {
        return nextOrdinal;
    }

    public void write(DataOutput out) throws IOException {
        out.writeInt(MAGIC);
        out.writeInt(FORMAT_VERSION);
        out.writeInt(dimension);
        out.writeUTF(similarityFunction.name());
        out.writeInt(maxDegree);
        out.writeInt(efConstruction);
        quantizerConfig.write(out);
        out.writeLong(codebookVersion);
        out.writeInt(nextOrdinal);
    }

    public static IndexHeader read(DataInput in) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC) {
            throw new IOException(String.format("Not an index header: magic %08x", magic));
        }
        int format = in.readInt();
        if (format != FORMAT_VERSION) {
            throw new IOException("Unsupported index format " + format);
        }
        int dimension = in.readInt();
        var vsf = VectorSimilarityFunction.valueOf(in.readUTF());
        int maxDegree = in.readInt();
        int efConstruction = in.readInt();
        var quantizerConfig = QuantizerConfig.read(in);
        long codebookVersion = in.readLong();
        int nextOrdinal = in.readInt();
        return new IndexHeader(dimension, vsf, maxDegree, efConstruction, quantizerConfig, codebookVersion, nextOrdinal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexHeader that = (IndexHeader) o;
        return dimension == that.dimension && maxDegree == that.maxDegree && efConstruction == that.efConstruction
               && codebookVersion == that.codebookVersion && nextOrdinal == that.nextOrdinal
               && similarityFunction == that.similarityFunction && quantizerConfig.equals(that.quantizerConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, similarityFunction, maxDegree, efConstruction, quantizerConfig, codebookVersion, nextOrdinal);
    }

    @Override
    public String toString() {
        return String.format("IndexHeader(dimension=%d, %s, M=%d, efConstruction=%d, %s, codebookVersion=%d, nextOrdinal=%d)",
                             dimension, similarityFunction, maxDegree, efConstruction, quantizerConfig, codebookVersion, nextOrdinal);
    }
}
