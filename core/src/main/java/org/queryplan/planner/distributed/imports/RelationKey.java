/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Qualified name of a stored relation: {@code user:program:relation}.
 *
 * @param userName owner of the relation
 * @param programName program namespace
 * @param relationName relation name
 */
public record RelationKey(String userName, String programName, String relationName) {

  public static final String DEFAULT_USER = "public";

  public static final String DEFAULT_PROGRAM = "adhoc";

  public RelationKey {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(userName), "user name must not be empty");
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(programName), "program name must not be empty");
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(relationName), "relation name must not be empty");
  }

  /** Relation in the default user and program namespace. */
  public static RelationKey of(String relationName) {
    return new RelationKey(DEFAULT_USER, DEFAULT_PROGRAM, relationName);
  }

  /**
   * Parses {@code relation}, {@code program:relation} or {@code user:program:relation}.
   *
   * @param qualifiedName qualified name
   * @return relation key
   */
  public static RelationKey parse(String qualifiedName) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(qualifiedName), "relation name must not be empty");
    String[] parts = qualifiedName.split(":", -1);
    switch (parts.length) {
      case 1:
        return of(parts[0]);
      case 2:
        return new RelationKey(DEFAULT_USER, parts[0], parts[1]);
      case 3:
        return new RelationKey(parts[0], parts[1], parts[2]);
      default:
        throw new IllegalArgumentException("Invalid relation name " + qualifiedName);
    }
  }

  /** Wire form embedded in the insert operator. */
  public Map<String, Object> toProperties() {
    return ImmutableMap.of(
        "userName", userName, "programName", programName, "relationName", relationName);
  }

  @Override
  public String toString() {
    return userName + ":" + programName + ":" + relationName;
  }
}
