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
package org.hubverse.transforms;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for ModelOutputFileName.
 */
@Tag("unit")
public class ModelOutputFileNameTest {

  @Test void testParse() {
    ModelOutputFileName name = ModelOutputFileName.parse("2420-01-01-teamA-model1");
    assertEquals("2420-01-01", name.getRoundId());
    assertEquals("teamA", name.getTeam());
    assertEquals("model1", name.getModel());
  }

  @Test void testParseKeepsUnderscoresAndDots() {
    ModelOutputFileName name = ModelOutputFileName.parse("2420-01-01-janeways_addiction-voyager.1");
    assertEquals("janeways_addiction", name.getTeam());
    assertEquals("voyager.1", name.getModel());
  }

  @Test void testTooManyHyphens() {
    assertThrows(FilenameFormatException.class,
        () -> ModelOutputFileName.parse("2420-01-01-janeways-addiction-voyager1"));
    assertThrows(FilenameFormatException.class,
        () -> ModelOutputFileName.parse("2420-01-01-team-extra-model"));
  }

  @Test void testRoundIdMustBeDate() {
    assertThrows(FilenameFormatException.class,
        () -> ModelOutputFileName.parse("round_id-team-model"));
    assertThrows(FilenameFormatException.class,
        () -> ModelOutputFileName.parse("2420-1-01-team-model"));
    assertThrows(FilenameFormatException.class,
        () -> ModelOutputFileName.parse("24200101-team-model"));
  }

  @Test void testTooFewParts() {
    assertThrows(FilenameFormatException.class, () -> ModelOutputFileName.parse("voyager-1"));
    assertThrows(FilenameFormatException.class, () -> ModelOutputFileName.parse("voyager1"));
    assertThrows(FilenameFormatException.class, () -> ModelOutputFileName.parse(""));
  }

  @Test void testMessageNamesFile() {
    FilenameFormatException e = assertThrows(FilenameFormatException.class,
        () -> ModelOutputFileName.parse("voyager-1"));
    assertEquals("Unexpected model-output file name format: voyager-1", e.getMessage());
  }

  @Test void testEquality() {
    assertEquals(ModelOutputFileName.parse("2420-01-01-a-b"),
        ModelOutputFileName.parse("2420-01-01-a-b"));
    assertEquals(ModelOutputFileName.parse("2420-01-01-a-b").hashCode(),
        ModelOutputFileName.parse("2420-01-01-a-b").hashCode());
    assertNotEquals(ModelOutputFileName.parse("2420-01-01-a-b"),
        ModelOutputFileName.parse("2420-01-01-a-c"));
  }
}
