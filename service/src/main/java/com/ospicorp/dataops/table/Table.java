package com.ospicorp.dataops.table;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory table: ordered rows of named, loosely typed cells. Column order is the order
 * in which names first appear. Cells are normalized on the way in (see {@link Values#normalize}).
 */
public final class Table {
  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  private Table(List<String> columns, List<Map<String, Object>> rows) {
    this.columns = Collections.unmodifiableList(columns);
    this.rows = Collections.unmodifiableList(rows);
  }

  public static Table of(List<? extends Map<String, ?>> records) {
    Set<String> names = new LinkedHashSet<>();
    if (records != null) {
      for (Map<String, ?> record : records) {
        if (record != null) {
          names.addAll(record.keySet());
        }
      }
    }
    return of(new ArrayList<>(names), records);
  }

  public static Table of(List<String> columns, List<? extends Map<String, ?>> records) {
    List<String> cols = List.copyOf(columns);
    List<Map<String, Object>> copy = new ArrayList<>(records == null ? 0 : records.size());
    if (records != null) {
      for (Map<String, ?> record : records) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : cols) {
          row.put(column, record == null ? null : Values.normalize(record.get(column)));
        }
        copy.add(Collections.unmodifiableMap(row));
      }
    }
    return new Table(new ArrayList<>(cols), copy);
  }

  public List<String> columns() {
    return columns;
  }

  @JsonValue
  public List<Map<String, Object>> rows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean hasColumn(String name) {
    return name != null && columns.contains(name);
  }

  public Object get(int row, String column) {
    return rows.get(row).get(column);
  }

  public List<Object> column(String name) {
    List<Object> values = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(name));
    }
    return values;
  }

  /** A table with the given rows removed, keeping the order of the rest. */
  public Table withoutRows(Set<Integer> rowIndexes) {
    List<Map<String, Object>> kept = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      if (!rowIndexes.contains(i)) {
        kept.add(rows.get(i));
      }
    }
    return new Table(new ArrayList<>(columns), kept);
  }

  /** Mutable copies of every row, each carrying every column so missing cells stay explicit. */
  public List<Map<String, Object>> toRecords() {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> record = new LinkedHashMap<>();
      for (String column : columns) {
        record.put(column, row.get(column));
      }
      out.add(record);
    }
    return out;
  }

  /** Same shape with every floating cell rounded to two decimals. */
  public Table rounded() {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (String column : columns) {
        copy.put(column, Values.roundCell(row.get(column)));
      }
      out.add(Collections.unmodifiableMap(copy));
    }
    return new Table(new ArrayList<>(columns), out);
  }

  @Override
  public String toString() {
    return "Table" + columns + " (" + rows.size() + " rows)";
  }
}
