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

package io.github.proxgraph.quantization;

import io.github.proxgraph.exceptions.DimensionMismatchException;
import io.github.proxgraph.exceptions.InsufficientSamplesException;
import io.github.proxgraph.util.PhysicalCoreExecutor;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.VectorUtil;
import io.github.proxgraph.vector.VectorizationProvider;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Product Quantization for float vectors.  The vector is split into M contiguous subspaces and
 * each subspace is quantized to the nearest of {@code 2^bitsPerCode} centroids learned by k-means,
 * giving a code of M bytes.
 * <p>
 * When the dimension is not a multiple of M, the first {@code dimension % M} subspaces get one extra
 * dimension.
 */
public class ProductQuantization implements VectorCompressor<ByteSequence<?>> {
    private static final Logger LOG = LoggerFactory.getLogger(ProductQuantization.class);
    private static final VectorTypeSupport vectorTypeSupport = VectorizationProvider.getInstance().getVectorTypeSupport();

    final VectorFloat<?>[] codebooks; // array of codebooks, where each codebook is a VectorFloat consisting of k contiguous subvectors each of length M
    private final int bitsPerCode;
    private final int clusterCount;
    private final int originalDimension;
    final int[][] subvectorSizesAndOffsets;
    private final PcaRotation rotation;
    // per subspace and centroid, the centroid's squared norm
    private final VectorFloat<?> squaredNorms;

    ProductQuantization(VectorFloat<?>[] codebooks, int bitsPerCode, int[][] subvectorSizesAndOffsets, PcaRotation rotation) {
        this.codebooks = codebooks;
        this.bitsPerCode = bitsPerCode;
        this.clusterCount = 1 << bitsPerCode;
        this.subvectorSizesAndOffsets = subvectorSizesAndOffsets;
        this.originalDimension = Arrays.stream(subvectorSizesAndOffsets).mapToInt(m -> m[0]).sum();
        this.rotation = rotation;

        this.squaredNorms = vectorTypeSupport.createFloatVector(codebooks.length * clusterCount);
        for (int m = 0; m < codebooks.length; m++) {
            int size = subvectorSizesAndOffsets[m][0];
            for (int c = 0; c < clusterCount; c++) {
                squaredNorms.set(m * clusterCount + c, VectorUtil.dotProduct(codebooks[m], c * size, codebooks[m], c * size, size));
            }
        }
    }

    public static ProductQuantization train(List<? extends VectorFloat<?>> sample, QuantizerConfig config, long seed) {
        return train(sample, config, seed, PhysicalCoreExecutor.pool());
    }

    /**
     * Learns a codebook from the sample.  Pure: the sample is not modified, and the same sample, config
     * and seed give the same codebook.
     *
     * @throws InsufficientSamplesException if the sample has fewer than {@link QuantizerConfig#requiredSamples()} vectors
     */
    public static ProductQuantization train(List<? extends VectorFloat<?>> sample, QuantizerConfig config, long seed, ForkJoinPool simdExecutor) {
        if (config.getType() != QuantizerConfig.Type.PRODUCT) {
            throw new IllegalArgumentException("Not a product quantizer configuration: " + config);
        }
        if (sample.size() < config.requiredSamples()) {
            throw new InsufficientSamplesException(config.requiredSamples(), sample.size());
        }
        int dimension = sample.get(0).length();
        for (VectorFloat<?> v : sample) {
            DimensionMismatchException.check(dimension, v.length());
        }
        int M = config.getSubspaceCount();
        if (M > dimension) {
            throw new IllegalArgumentException(String.format("Cannot split %d dimensions into %d subspaces", dimension, M));
        }

        var subvectorSizesAndOffsets = getSubvectorSizesAndOffsets(dimension, M);
        PcaRotation rotation = null;
        List<? extends VectorFloat<?>> trainingVectors = sample;
        if (config.isRotate()) {
            int[] sizes = Arrays.stream(subvectorSizesAndOffsets).mapToInt(m -> m[0]).toArray();
            rotation = PcaRotation.fit(sample, sizes);
            var r = rotation;
            trainingVectors = simdExecutor.submit(() -> sample.parallelStream().map(r::apply).collect(Collectors.toList())).join();
        }

        var vectors = trainingVectors;
        int clusterCount = config.getClusterCount();
        var codebooks = simdExecutor.submit(() -> IntStream.range(0, M).parallel()
                        .mapToObj(m -> {
                            int size = subvectorSizesAndOffsets[m][0];
                            int offset = subvectorSizesAndOffsets[m][1];
                            VectorFloat<?>[] subvectors = new VectorFloat<?>[vectors.size()];
                            for (int i = 0; i < subvectors.length; i++) {
                                var sub = vectorTypeSupport.createFloatVector(size);
                                sub.copyFrom(vectors.get(i), offset, 0, size);
                                subvectors[i] = sub;
                            }
                            var clusterer = new KMeansPlusPlusClusterer(subvectors, clusterCount, new Random(seed + m));
                            return clusterer.cluster(config.getIterations());
                        })
                        .toArray(VectorFloat<?>[]::new))
                .join();

        var pq = new ProductQuantization(codebooks, config.getBitsPerCode(), subvectorSizesAndOffsets, rotation);
        LOG.debug("Trained {} on {} samples", pq, sample.size());
        return pq;
    }

    @Override
    public MutableCompressedVectors<ByteSequence<?>> createCompressedVectors(int initialCapacity) {
        return new PQVectors(this, initialCapacity);
    }

    @Override
    public ByteSequence<?> encode(VectorFloat<?> vector) {
        var result = vectorTypeSupport.createByteSequence(codebooks.length);
        encodeTo(vector, result);
        return result;
    }

    @Override
    public void encodeTo(VectorFloat<?> vector, ByteSequence<?> dest) {
        DimensionMismatchException.check(originalDimension, vector.length());
        var v = rotation == null ? vector : rotation.apply(vector);
        for (int m = 0; m < codebooks.length; m++) {
            int size = subvectorSizesAndOffsets[m][0];
            int offset = subvectorSizesAndOffsets[m][1];
            dest.set(m, (byte) KMeansPlusPlusClusterer.nearestCentroid(v, offset, codebooks[m], clusterCount, size));
        }
    }

    @Override
    public VectorFloat<?> decode(ByteSequence<?> encoded) {
        var target = vectorTypeSupport.createFloatVector(originalDimension);
        for (int m = 0; m < codebooks.length; m++) {
            int size = subvectorSizesAndOffsets[m][0];
            int offset = subvectorSizesAndOffsets[m][1];
            int centroidIndex = Byte.toUnsignedInt(encoded.get(m));
            target.copyFrom(codebooks[m], centroidIndex * size, offset, size);
        }
        return rotation == null ? target : rotation.applyInverse(target);
    }

    /**
     * Builds the asymmetric distance lookup table for a query: {@code clusterCount} entries per subspace,
     * holding squared distances (EUCLIDEAN) or dot products (otherwise) between the query's sub-vector and
     * each centroid.
     */
    VectorFloat<?> partialTable(VectorFloat<?> query, VectorSimilarityFunction vsf) {
        DimensionMismatchException.check(originalDimension, query.length());
        var q = rotation == null ? query : rotation.apply(query);
        var table = vectorTypeSupport.createFloatVector(codebooks.length * clusterCount);
        for (int m = 0; m < codebooks.length; m++) {
            int size = subvectorSizesAndOffsets[m][0];
            int offset = subvectorSizesAndOffsets[m][1];
            for (int c = 0; c < clusterCount; c++) {
                float partial = vsf == VectorSimilarityFunction.EUCLIDEAN
                        ? VectorUtil.squareL2Distance(codebooks[m], c * size, q, offset, size)
                        : VectorUtil.dotProduct(codebooks[m], c * size, q, offset, size);
                table.set(m * clusterCount + c, partial);
            }
        }
        return table;
    }

    VectorFloat<?> squaredNorms() {
        return squaredNorms;
    }

    static int[][] getSubvectorSizesAndOffsets(int dimensions, int M) {
        if (M > dimensions) {
            throw new IllegalArgumentException("Number of subspaces must be less than or equal to the vector dimension");
        }
        int[][] sizes = new int[M][];
        int baseSize = dimensions / M;
        int remainder = dimensions % M;
        // distribute the remainder among the subvectors
        int offset = 0;
        for (int i = 0; i < M; i++) {
            int size = baseSize + (i < remainder ? 1 : 0);
            sizes[i] = new int[]{size, offset};
            offset += size;
        }
        return sizes;
    }

    public int getSubspaceCount() {
        return codebooks.length;
    }

    public int getClusterCount() {
        return clusterCount;
    }

    public boolean isRotated() {
        return rotation != null;
    }

    @Override
    public int getDimension() {
        return originalDimension;
    }

    @Override
    public QuantizerConfig.Type getType() {
        return QuantizerConfig.Type.PRODUCT;
    }

    @Override
    public int compressedVectorSize() {
        return codebooks.length;
    }

    @Override
    public void write(DataOutput out) throws IOException {
        out.writeByte(getType().ordinal());
        out.writeInt(originalDimension);
        out.writeInt(codebooks.length);
        out.writeInt(bitsPerCode);
        for (var a : subvectorSizesAndOffsets) {
            out.writeInt(a[0]);
        }
        out.writeBoolean(rotation != null);
        if (rotation != null) {
            rotation.write(out);
        }
        for (var codebook : codebooks) {
            vectorTypeSupport.writeFloatVector(out, codebook);
        }
    }

    /**
     * Reads a codebook written by {@link #write}, after the type tag has been consumed.
     */
    static ProductQuantization load(DataInput in) throws IOException {
        int dimension = in.readInt();
        int M = in.readInt();
        int bitsPerCode = in.readInt();
        if (M <= 0 || M > dimension || bitsPerCode < 1 || bitsPerCode > 8) {
            throw new IOException(String.format("Invalid PQ header: dimension=%d, M=%d, bits=%d", dimension, M, bitsPerCode));
        }
        int[][] subvectorSizes = new int[M][];
        int offset = 0;
        for (int i = 0; i < M; i++) {
            int size = in.readInt();
            subvectorSizes[i] = new int[]{size, offset};
            offset += size;
        }
        if (offset != dimension) {
            throw new IOException("PQ subspace sizes sum to " + offset + ", expected " + dimension);
        }
        PcaRotation rotation = in.readBoolean() ? PcaRotation.load(in) : null;
        int clusterCount = 1 << bitsPerCode;
        VectorFloat<?>[] codebooks = new VectorFloat<?>[M];
        for (int m = 0; m < M; m++) {
            codebooks[m] = vectorTypeSupport.readFloatVector(in, clusterCount * subvectorSizes[m][0]);
        }
        return new ProductQuantization(codebooks, bitsPerCode, subvectorSizes, rotation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProductQuantization)) return false;
        ProductQuantization that = (ProductQuantization) o;
        return bitsPerCode == that.bitsPerCode
               && originalDimension == that.originalDimension
               && Arrays.deepEquals(subvectorSizesAndOffsets, that.subvectorSizesAndOffsets)
               && Arrays.equals(codebooks, that.codebooks)
               && (rotation == null ? that.rotation == null : that.rotation != null && rotation.getMatrix().equals(that.rotation.getMatrix()));
    }

    @Override
    public int hashCode() {
        int result = 31 * bitsPerCode + originalDimension;
        result = 31 * result + Arrays.deepHashCode(subvectorSizesAndOffsets);
        return 31 * result + Arrays.hashCode(codebooks);
    }

    @Override
    public String toString() {
        return String.format("ProductQuantization(M=%d, clusters=%d, rotated=%s)", codebooks.length, clusterCount, rotation != null);
    }
}
