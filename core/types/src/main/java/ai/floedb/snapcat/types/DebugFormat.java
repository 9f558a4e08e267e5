/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.snapcat.types;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Human-readable rendering of a {@link ValueView}, used wherever a value has no typed column.
 *
 * <p>Format: structs as {@code Name { a: 1, b: 2 }}, tuple structs as {@code Name(1, 2)}, tuples as
 * {@code (1, 2)}, enum variants as {@code Variant} or {@code Variant(..)}, lists as {@code [1, 2]},
 * maps as {@code {k: v}}, strings quoted. Floats always carry a fractional part.
 */
public final class DebugFormat {

  private DebugFormat() {}

  public static String of(ValueView view) {
    StringBuilder sb = new StringBuilder();
    append(sb, view);
    return sb.toString();
  }

  /** Renders each item and joins them as {@code [v1, v2, ...]}. */
  public static String ofItems(List<ValueView> items) {
    StringJoiner j = new StringJoiner(", ", "[", "]");
    for (ValueView item : items) {
      j.add(of(item));
    }
    return j.toString();
  }

  private static void append(StringBuilder sb, ValueView view) {
    if (view instanceof ValueView.ScalarValue s) {
      sb.append(scalar(s));
    } else if (view instanceof ValueView.OpaqueValue o) {
      opaque(sb, o.value());
    } else if (view instanceof ValueView.StructValue st) {
      sb.append(shortName(st.typePath()));
      if (st.fields().isEmpty()) {
        return;
      }
      sb.append(" { ");
      for (int i = 0; i < st.fields().size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        ValueView.FieldValue f = st.fields().get(i);
        sb.append(f.name()).append(": ");
        append(sb, f.value());
      }
      sb.append(" }");
    } else if (view instanceof ValueView.TupleValue t) {
      sb.append(shortName(t.typePath()));
      appendPositional(sb, t.fields());
    } else if (view instanceof ValueView.EnumValue e) {
      sb.append(e.variant());
      if (!e.payload().isEmpty()) {
        appendPositional(sb, e.payload());
      }
    } else if (view instanceof ValueView.ListValue l) {
      sb.append(ofItems(l.items()));
    } else if (view instanceof ValueView.MapValue m) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<ValueView, ValueView> entry : m.entries().entrySet()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        append(sb, entry.getKey());
        sb.append(": ");
        append(sb, entry.getValue());
      }
      sb.append('}');
    }
  }

  private static void appendPositional(StringBuilder sb, List<ValueView> fields) {
    sb.append('(');
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      append(sb, fields.get(i));
    }
    sb.append(')');
  }

  private static String scalar(ValueView.ScalarValue s) {
    Object v = s.value();
    return switch (s.kind()) {
      case U64 -> Long.toUnsignedString((Long) v);
      case ENTITY -> "Entity(" + Long.toUnsignedString((Long) v) + ")";
      default -> String.valueOf(v);
    };
  }

  private static void opaque(StringBuilder sb, Object value) {
    if (value instanceof CharSequence text) {
      sb.append('"');
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        switch (c) {
          case '"' -> sb.append("\\\"");
          case '\\' -> sb.append("\\\\");
          case '\n' -> sb.append("\\n");
          case '\t' -> sb.append("\\t");
          default -> sb.append(c);
        }
      }
      sb.append('"');
      return;
    }
    sb.append(value);
  }

  /** Last segment of a {@code ::}- or {@code .}-separated type path; empty for an empty path. */
  public static String shortName(String typePath) {
    int colons = typePath.lastIndexOf("::");
    int dot = typePath.lastIndexOf('.');
    int cut = Math.max(colons < 0 ? -1 : colons + 2, dot < 0 ? -1 : dot + 1);
    return cut < 0 ? typePath : typePath.substring(cut);
  }
}
