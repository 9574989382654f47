package com.eafix.reentry.infrastructure.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 CSV: comma separated, CRLF row terminator, a cell is quoted only when
 * it contains a comma, quote, CR or LF, and quotes inside are doubled.
 *
 * The parser accepts LF or CRLF terminators.
 */
public final class CsvCodec {
    public static final String ROW_TERMINATOR = "\r\n";

    private CsvCodec() {}

    public static String formatRow(List<String> cells) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(quote(cells.get(i)));
        }
        return sb.append(ROW_TERMINATOR).toString();
    }

    static String quote(String cell) {
        if (cell == null) {
            return "";
        }
        boolean needsQuotes = cell.indexOf(',') >= 0 || cell.indexOf('"') >= 0
            || cell.indexOf('\r') >= 0 || cell.indexOf('\n') >= 0;
        if (!needsQuotes) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    /**
     * Parse CSV text into rows of cells. A trailing terminator does not produce an empty row.
     *
     * @throws IllegalArgumentException on an unterminated quoted cell
     */
    public static List<List<String>> parse(String content) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;
        boolean rowStarted = false;
        int i = 0;
        int n = content.length();

        while (i < n) {
            char c = content.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < n && content.charAt(i + 1) == '"') {
                        cell.append('"');
                        i += 2;
                        continue;
                    }
                    inQuotes = false;
                } else {
                    cell.append(c);
                }
                i++;
                continue;
            }
            switch (c) {
                case '"' -> {
                    inQuotes = true;
                    rowStarted = true;
                }
                case ',' -> {
                    row.add(cell.toString());
                    cell.setLength(0);
                    rowStarted = true;
                }
                case '\r', '\n' -> {
                    if (c == '\r' && i + 1 < n && content.charAt(i + 1) == '\n') {
                        i++;
                    }
                    row.add(cell.toString());
                    cell.setLength(0);
                    rows.add(row);
                    row = new ArrayList<>();
                    rowStarted = false;
                }
                default -> {
                    cell.append(c);
                    rowStarted = true;
                }
            }
            i++;
        }
        if (inQuotes) {
            throw new IllegalArgumentException("Unterminated quoted cell in row " + (rows.size() + 1));
        }
        if (rowStarted || cell.length() > 0) {
            row.add(cell.toString());
            rows.add(row);
        }
        return rows;
    }
}
