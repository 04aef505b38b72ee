/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.hubverse.transforms.lambda;

import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ObjectKeyFilter.
 */
@Tag("unit")
public class ObjectKeyFilterTest {

  private final ObjectKeyFilter filter =
      ObjectKeyFilter.fromConfig(TransformConfig.builder().build());

  @Test void testAcceptsDataFiles() {
    assertTrue(filter.accepts("raw/prefix1/2420-01-01-teamA-model1.csv"));
    assertTrue(filter.accepts("raw/2420-01-01-teamA-model1.parquet"));
    assertNull(filter.skipReason("raw/2420-01-01-teamA-model1.csv"));
  }

  @Test void testSkipsMetadata() {
    assertFalse(filter.accepts("raw/model-metadata/teamA-model1.csv"));
    assertFalse(filter.accepts("raw/prefix1/metadata.parquet"));
    assertEquals("key contains 'metadata'", filter.skipReason("raw/model-metadata/a.yml"));
  }

  @Test void testSkipsOtherExtensions() {
    assertFalse(filter.accepts("raw/prefix1/2420-01-01-teamA-model1.json"));
    assertFalse(filter.accepts("raw/prefix1/README"));
    assertFalse(filter.accepts("raw/prefix1/2420-01-01-teamA-model1.CSV"));
    assertEquals("key has no file extension", filter.skipReason("raw/prefix1/README"));
  }

  @Test void testCustomConfiguration() {
    ObjectKeyFilter custom = new ObjectKeyFilter(ImmutableSet.of("tmp", "draft"),
        ImmutableSet.of(".parquet"));

    assertEquals(ImmutableSet.of("parquet"), custom.getAllowedExtensions());
    assertTrue(custom.accepts("raw/metadata/2420-01-01-a-b.parquet"));
    assertFalse(custom.accepts("raw/2420-01-01-a-b.csv"));
    assertFalse(custom.accepts("raw/draft/2420-01-01-a-b.parquet"));
  }

  @Test void testNoMarkers() {
    ObjectKeyFilter noMarkers = new ObjectKeyFilter(ImmutableSet.<String>of(),
        ImmutableSet.of("csv"));
    assertTrue(noMarkers.accepts("raw/metadata.csv"));
  }
}
