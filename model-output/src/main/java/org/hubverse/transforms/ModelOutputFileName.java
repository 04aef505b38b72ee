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

import com.google.common.base.CharMatcher;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Metadata encoded in a model-output file name of the form
 * {@code [round_id]-[team]-[model]}, where the round id is a
 * {@code YYYY-MM-DD} date stamp.
 *
 * <p>The name is split on {@code '-'} from the right into at most three parts.
 * Team and model identifiers may not contain hyphens: a name with more than
 * four hyphens in total is rejected rather than guessed at.
 */
public final class ModelOutputFileName {
  static final char SEPARATOR = '-';
  static final int MAX_SEPARATORS = 4;

  private static final CharMatcher SEPARATOR_MATCHER = CharMatcher.is(SEPARATOR);
  private static final Pattern ROUND_ID_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  private final String roundId;
  private final String team;
  private final String model;

  private ModelOutputFileName(String roundId, String team, String model) {
    this.roundId = roundId;
    this.team = team;
    this.model = model;
  }

  /**
   * Parses a file base name (no directory, no extension).
   *
   * @param fileName Base name, e.g. {@code 2420-01-01-teamA-model1}
   * @return the parsed parts
   * @throws FilenameFormatException if the name does not have the expected shape
   */
  public static ModelOutputFileName parse(String fileName) {
    Objects.requireNonNull(fileName, "fileName");

    if (SEPARATOR_MATCHER.countIn(fileName) > MAX_SEPARATORS) {
      throw new FilenameFormatException(fileName);
    }

    int modelStart = fileName.lastIndexOf(SEPARATOR);
    int teamStart = modelStart > 0 ? fileName.lastIndexOf(SEPARATOR, modelStart - 1) : -1;
    if (teamStart < 0) {
      throw new FilenameFormatException(fileName);
    }

    String roundId = fileName.substring(0, teamStart);
    if (!ROUND_ID_PATTERN.matcher(roundId).matches()) {
      throw new FilenameFormatException(fileName);
    }
    return new ModelOutputFileName(roundId,
        fileName.substring(teamStart + 1, modelStart),
        fileName.substring(modelStart + 1));
  }

  public String getRoundId() {
    return roundId;
  }

  public String getTeam() {
    return team;
  }

  public String getModel() {
    return model;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ModelOutputFileName)) {
      return false;
    }
    ModelOutputFileName that = (ModelOutputFileName) o;
    return roundId.equals(that.roundId)
        && team.equals(that.team)
        && model.equals(that.model);
  }

  @Override public int hashCode() {
    return Objects.hash(roundId, team, model);
  }

  @Override public String toString() {
    return "{round_id=" + roundId + ", team=" + team + ", model=" + model + "}";
  }
}
