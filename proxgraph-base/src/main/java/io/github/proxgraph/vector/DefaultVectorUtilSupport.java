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

package io.github.proxgraph.vector;

import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * A VectorUtilSupport implementation supported by JDK 11+. This implementation assumes the VectorFloat/ByteSequence
 * objects wrap an on-heap array of the corresponding type.
 */
final class DefaultVectorUtilSupport implements VectorUtilSupport {

  @Override
  public float dotProduct(VectorFloat<?> av, VectorFloat<?> bv) {
    return dotProduct(av, 0, bv, 0, av.length());
  }

  @Override
  public float dotProduct(VectorFloat<?> av, int aoffset, VectorFloat<?> bv, int boffset, int length) {
    float[] b = ((ArrayVectorFloat) bv).get();
    float[] a = ((ArrayVectorFloat) av).get();

    float res = 0f;
    int i = 0;

    // unrolled four ways to expose independent accumulators
    int upperBound = length & ~3;
    float acc1 = 0, acc2 = 0, acc3 = 0, acc4 = 0;
    for (; i < upperBound; i += 4) {
      acc1 += a[aoffset + i] * b[boffset + i];
      acc2 += a[aoffset + i + 1] * b[boffset + i + 1];
      acc3 += a[aoffset + i + 2] * b[boffset + i + 2];
      acc4 += a[aoffset + i + 3] * b[boffset + i + 3];
    }
    res += acc1 + acc2 + acc3 + acc4;
    for (; i < length; i++) {
      res += a[aoffset + i] * b[boffset + i];
    }
    return res;
  }

  @Override
  public float cosine(VectorFloat<?> av, VectorFloat<?> bv) {
    float[] a = ((ArrayVectorFloat) av).get();
    float[] b = ((ArrayVectorFloat) bv).get();

    float sum = 0.0f;
    float norm1 = 0.0f;
    float norm2 = 0.0f;
    for (int i = 0; i < a.length; i++) {
      float elem1 = a[i];
      float elem2 = b[i];
      sum += elem1 * elem2;
      norm1 += elem1 * elem1;
      norm2 += elem2 * elem2;
    }
    if (norm1 == 0 || norm2 == 0) {
      return 0f;
    }
    return (float) (sum / Math.sqrt((double) norm1 * (double) norm2));
  }

  @Override
  public float squareDistance(VectorFloat<?> av, VectorFloat<?> bv) {
    return squareDistance(av, 0, bv, 0, av.length());
  }

  @Override
  public float squareDistance(VectorFloat<?> av, int aoffset, VectorFloat<?> bv, int boffset, int length) {
    float[] a = ((ArrayVectorFloat) av).get();
    float[] b = ((ArrayVectorFloat) bv).get();

    float squareSum = 0f;
    for (int i = 0; i < length; i++) {
      float diff = a[aoffset + i] - b[boffset + i];
      squareSum += diff * diff;
    }
    return squareSum;
  }

  @Override
  public float sum(VectorFloat<?> vector) {
    float sum = 0;
    for (int i = 0; i < vector.length(); i++) {
      sum += vector.get(i);
    }
    return sum;
  }

  @Override
  public void scale(VectorFloat<?> vector, float multiplier) {
    for (int i = 0; i < vector.length(); i++) {
      vector.set(i, vector.get(i) * multiplier);
    }
  }

  @Override
  public void addInPlace(VectorFloat<?> v1, VectorFloat<?> v2) {
    for (int i = 0; i < v1.length(); i++) {
      v1.set(i, v1.get(i) + v2.get(i));
    }
  }

  @Override
  public void subInPlace(VectorFloat<?> v1, VectorFloat<?> v2) {
    for (int i = 0; i < v1.length(); i++) {
      v1.set(i, v1.get(i) - v2.get(i));
    }
  }

  @Override
  public VectorFloat<?> sub(VectorFloat<?> lhs, VectorFloat<?> rhs) {
    float[] result = new float[lhs.length()];
    for (int i = 0; i < result.length; i++) {
      result[i] = lhs.get(i) - rhs.get(i);
    }
    return new ArrayVectorFloat(result);
  }

  @Override
  public float assembleAndSum(VectorFloat<?> data, int dataBase, ByteSequence<?> dataOffsets) {
    float sum = 0f;
    for (int i = 0; i < dataOffsets.length(); i++) {
      sum += data.get(dataBase * i + Byte.toUnsignedInt(dataOffsets.get(i)));
    }
    return sum;
  }

  @Override
  public float max(VectorFloat<?> v) {
    float max = -Float.MAX_VALUE;
    for (int i = 0; i < v.length(); i++) {
      max = Math.max(max, v.get(i));
    }
    return max;
  }

  @Override
  public float min(VectorFloat<?> v) {
    float min = Float.MAX_VALUE;
    for (int i = 0; i < v.length(); i++) {
      min = Math.min(min, v.get(i));
    }
    return min;
  }
}
