package work.gpflow.kernel.external;

/**
 * Layout options for reading or writing a table file. {@code sheet} only applies to workbook formats.
 */
public record TableLayout(char delimiter, boolean headerRow, String sheet) {
    public static TableLayout delimited(char delimiter, boolean headerRow) {
        return new TableLayout(delimiter, headerRow, null);
    }
}
