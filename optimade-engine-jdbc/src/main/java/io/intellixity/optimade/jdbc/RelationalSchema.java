package io.intellixity.optimade.jdbc;

import io.intellixity.optimade.filter.transform.FieldAliases;

import java.util.*;

/**
 * Table layout of a relational entry store.
 * <p>
 * SPECIAL fields are columns of the main table. Every other field lives in one of the typed
 * key/value tables {@code (structure_id, key, value)}; a repeated key holds a list. List fields
 * backed by their own table {@code (structure_id, <column>)} are declared explicitly.
 */
public final class RelationalSchema {
  public enum ValueKind { INT, FLOAT, STRING }

  /** Table holding one row per list member. */
  public record ListTable(String table, String column) {
    public ListTable {
      requireIdent(table, "table");
      requireIdent(column, "column");
    }
  }

  public static final String MAIN_ALIAS = "s";
  public static final String OWNER_COLUMN = "structure_id";
  public static final String KEY_COLUMN = "key";
  public static final String VALUE_COLUMN = "value";

  private final String mainTable;
  private final String idColumn;
  private final Set<String> specialColumns;
  private final Map<String, ValueKind> kinds;
  private final Map<String, ListTable> listFields;
  private final Map<ValueKind, String> valueTables;

  public RelationalSchema(String mainTable,
                          String idColumn,
                          Set<String> specialColumns,
                          Map<String, ValueKind> kinds,
                          Map<String, ListTable> listFields) {
    this.mainTable = requireIdent(mainTable, "mainTable");
    this.idColumn = requireIdent(idColumn, "idColumn");
    Set<String> special = new LinkedHashSet<>();
    special.add(idColumn);
    for (String c : Objects.requireNonNull(specialColumns, "specialColumns")) special.add(requireIdent(c, "special column"));
    this.specialColumns = Collections.unmodifiableSet(special);
    this.kinds = Map.copyOf(Objects.requireNonNull(kinds, "kinds"));
    this.listFields = Map.copyOf(Objects.requireNonNull(listFields, "listFields"));
    for (String f : this.listFields.keySet()) {
      if (this.specialColumns.contains(f)) throw new IllegalArgumentException("List field '" + f + "' is also a special column");
    }
    Map<ValueKind, String> tables = new EnumMap<>(ValueKind.class);
    tables.put(ValueKind.INT, "ints");
    tables.put(ValueKind.FLOAT, "floats");
    tables.put(ValueKind.STRING, "strings");
    this.valueTables = Collections.unmodifiableMap(tables);
  }

  /** The {@code structures} layout: formula and count columns on the main table, elements in {@code species}. */
  public static RelationalSchema structures() {
    Set<String> special = new LinkedHashSet<>(List.of(
        "type", "last_modified", "nsites", "nelements", "nperiodic_dimensions",
        "chemical_formula_descriptive", "chemical_formula_reduced",
        "chemical_formula_anonymous", "chemical_formula_hill"));
    Map<String, ValueKind> kinds = new HashMap<>();
    kinds.put("id", ValueKind.STRING);
    kinds.put("type", ValueKind.STRING);
    kinds.put("last_modified", ValueKind.STRING);
    kinds.put("nsites", ValueKind.INT);
    kinds.put("nelements", ValueKind.INT);
    kinds.put("nperiodic_dimensions", ValueKind.INT);
    kinds.put("chemical_formula_descriptive", ValueKind.STRING);
    kinds.put("chemical_formula_reduced", ValueKind.STRING);
    kinds.put("chemical_formula_anonymous", ValueKind.STRING);
    kinds.put("chemical_formula_hill", ValueKind.STRING);
    Map<String, ListTable> lists = Map.of(
        "elements", new ListTable("species", "name"),
        "structure_features", new ListTable("structure_features", "value"));
    return new RelationalSchema("structures", "id", special, kinds, lists);
  }

  /** Length aliases matching {@link #structures()}: list fields answered by count columns. */
  public static FieldAliases structuresAliases() {
    Map<String, String> length = new LinkedHashMap<>();
    length.put("elements", "nelements");
    length.put("element_ratios", "nelements");
    length.put("cartesian_site_positions", "nsites");
    length.put("species_at_sites", "nsites");
    return new FieldAliases(Map.of(), length);
  }

  public String mainTable() { return mainTable; }
  public String idColumn() { return idColumn; }
  public Set<String> specialColumns() { return specialColumns; }
  public Map<String, ListTable> listFields() { return listFields; }
  public Collection<String> valueTables() { return valueTables.values(); }

  public boolean isSpecial(String field) { return specialColumns.contains(field); }

  public Optional<ValueKind> declaredKind(String field) { return Optional.ofNullable(kinds.get(field)); }

  public Optional<ListTable> listTable(String field) { return Optional.ofNullable(listFields.get(field)); }

  public String valueTable(ValueKind kind) { return valueTables.get(kind); }

  /** Qualified main-table column, e.g. {@code s.nelements}. */
  public String column(String field) {
    if (!isSpecial(field)) throw new IllegalArgumentException("'" + field + "' is not a column of " + mainTable);
    return MAIN_ALIAS + "." + field;
  }

  private static String requireIdent(String s, String what) {
    if (s == null || !s.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      throw new IllegalArgumentException(what + " must be a plain SQL identifier, got '" + s + "'");
    }
    return s;
  }
}
