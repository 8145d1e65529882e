/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Treats every property whose name contains {@code CHILD}, in any case, as a child reference
 * ({@code argChild}, {@code argChild1}, {@code childId}, ...).
 */
public class NamingConventionChildReferenceResolver implements ChildReferenceResolver {

  public static final String CHILD_TOKEN = "CHILD";

  private static final NamingConventionChildReferenceResolver INSTANCE =
      new NamingConventionChildReferenceResolver();

  public static NamingConventionChildReferenceResolver getInstance() {
    return INSTANCE;
  }

  /** Returns true if the property name follows the child reference naming convention. */
  public static boolean isChildReferenceKey(String key) {
    return StringUtils.containsIgnoreCase(key, CHILD_TOKEN);
  }

  @Override
  public Set<String> childFields(ObjectNode operator) {
    Set<String> fields = new LinkedHashSet<>();
    Iterator<String> names = operator.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (isChildReferenceKey(name)) {
        fields.add(name);
      }
    }
    return fields;
  }
}
