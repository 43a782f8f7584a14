/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.termwalk.util;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Estimates the size (memory representation) of Java objects.
 * <p>
 * Sizes assume a 64 bit JVM with compressed object pointers, which is the
 * default for heaps below 32 GB. The numbers are estimates, not exact
 * measurements.
 *
 * @termwalk.internal
 */
public final class RamUsageEstimator {

  /** Approximate memory usage that we assign to a {@link java.util.HashMap} entry. */
  public static final long HASHTABLE_RAM_BYTES_PER_ENTRY = 2 * 4 + 32 + 16;

  /** Number of bytes this JVM uses to represent an object reference. */
  public static final int NUM_BYTES_OBJECT_REF = 4;

  /** Number of bytes to represent an object header (no fields, no alignments). */
  public static final int NUM_BYTES_OBJECT_HEADER = 12;

  /** Number of bytes to represent an array header (no content, but with alignments). */
  public static final int NUM_BYTES_ARRAY_HEADER = 16;

  /** A constant specifying the object alignment boundary inside the JVM. */
  public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

  private RamUsageEstimator() {}

  /** Aligns an object size to be the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}. */
  public static long alignObjectSize(long size) {
    size += (long) NUM_BYTES_OBJECT_ALIGNMENT - 1L;
    return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
  }

  /** Returns the size in bytes of the byte[] object. */
  public static long sizeOf(byte[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + arr.length);
  }

  /** Returns the size in bytes of the int[] object. */
  public static long sizeOf(int[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Integer.BYTES * arr.length);
  }

  /** Returns the shallow size in bytes of an array of references with the given length. */
  public static long shallowSizeOfArray(int length) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_OBJECT_REF * length);
  }

  /**
   * Returns the shallow instance size in bytes an instance of the given class would occupy.
   * This works with all conventional classes and primitive types, but not with arrays
   * (the size then depends on the number of elements and varies from object to object).
   */
  public static long shallowSizeOfInstance(Class<?> clazz) {
    if (clazz.isArray()) {
      throw new IllegalArgumentException("This method does not work with array classes.");
    }
    if (clazz.isPrimitive()) {
      return primitiveSize(clazz);
    }

    long size = NUM_BYTES_OBJECT_HEADER;

    // Walk type hierarchy
    for (;clazz != null; clazz = clazz.getSuperclass()) {
      for (Field f : clazz.getDeclaredFields()) {
        if (!Modifier.isStatic(f.getModifiers())) {
          Class<?> type = f.getType();
          size += type.isPrimitive() ? primitiveSize(type) : NUM_BYTES_OBJECT_REF;
        }
      }
    }
    return alignObjectSize(size);
  }

  private static int primitiveSize(Class<?> type) {
    if (type == boolean.class || type == byte.class) {
      return 1;
    } else if (type == char.class || type == short.class) {
      return 2;
    } else if (type == int.class || type == float.class) {
      return 4;
    } else {
      return 8;
    }
  }
}
