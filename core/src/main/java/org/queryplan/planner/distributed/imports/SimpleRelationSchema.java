/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Schema given as parallel lists of column types and column names. */
@Getter
@EqualsAndHashCode
@ToString
public class SimpleRelationSchema implements RelationSchema {

  public static final String COLUMN_TYPES = "columnTypes";

  public static final String COLUMN_NAMES = "columnNames";

  private final List<String> columnTypes;

  private final List<String> columnNames;

  public SimpleRelationSchema(List<String> columnTypes, List<String> columnNames) {
    Preconditions.checkNotNull(columnTypes, "column types");
    Preconditions.checkNotNull(columnNames, "column names");
    Preconditions.checkArgument(
        columnTypes.size() == columnNames.size(),
        "Schema has %s column types but %s column names",
        columnTypes.size(),
        columnNames.size());
    this.columnTypes = ImmutableList.copyOf(columnTypes);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  @Override
  public Map<String, Object> toProperties() {
    return ImmutableMap.of(COLUMN_TYPES, columnTypes, COLUMN_NAMES, columnNames);
  }
}
