/*
 * Forcelink - Salesforce API Integration Runtime
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.forcelink.salesforce.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RFC-4180 CSV as spoken by Bulk API 2.0: comma delimited, LF line endings, fields quoted only
 * when they contain a delimiter, a quote or a line break.
 */
public class CsvCodec {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_ENDING = "\n";

    private final ObjectMapper objectMapper;

    public CsvCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Header is the union of the keys of all rows, in first-seen order.
     */
    public String write(List<Map<String, Object>> rows) {
        List<String> header = header(rows);
        StringBuilder csv = new StringBuilder();
        appendLine(csv, header);
        for (Map<String, Object> row : rows) {
            List<String> values = new ArrayList<>(header.size());
            for (String column : header) {
                values.add(render(row.get(column)));
            }
            appendLine(csv, values);
        }
        return csv.toString();
    }

    public static List<String> header(Collection<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }

    /**
     * Text form of a single value: null is empty, maps and lists become JSON.
     */
    public String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof Collection) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Value cannot be written as JSON: " + e.getOriginalMessage(), e);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Parses a CSV document with a header line. Every row is keyed by the header in column order;
     * short rows are padded with empty values.
     */
    public List<Map<String, String>> read(String csv) {
        List<List<String>> lines = parse(csv == null ? "" : csv);
        List<Map<String, String>> rows = new ArrayList<>();
        if (lines.isEmpty()) {
            return rows;
        }
        List<String> header = lines.get(0);
        for (int i = 1; i < lines.size(); i++) {
            List<String> values = lines.get(i);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                row.put(header.get(c), c < values.size() ? values.get(c) : "");
            }
            rows.add(row);
        }
        return rows;
    }

    private static void appendLine(StringBuilder csv, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                csv.append(DELIMITER);
            }
            csv.append(quote(values.get(i)));
        }
        csv.append(LINE_ENDING);
    }

    static String quote(String value) {
        boolean needsQuotes = value.indexOf(DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return value;
        }
        return QUOTE + value.replace("\"", "\"\"") + QUOTE;
    }

    private static List<List<String>> parse(String csv) {
        List<List<String>> lines = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean lineHasContent = false;

        for (int i = 0; i < csv.length(); i++) {
            char ch = csv.charAt(i);
            if (quoted) {
                if (ch == QUOTE) {
                    if (i + 1 < csv.length() && csv.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(ch);
                }
                continue;
            }
            switch (ch) {
                case QUOTE:
                    quoted = true;
                    lineHasContent = true;
                    break;
                case DELIMITER:
                    current.add(field.toString());
                    field.setLength(0);
                    lineHasContent = true;
                    break;
                case '\r':
                    break;
                case '\n':
                    if (lineHasContent || field.length() > 0) {
                        current.add(field.toString());
                        lines.add(current);
                    }
                    current = new ArrayList<>();
                    field.setLength(0);
                    lineHasContent = false;
                    break;
                default:
                    field.append(ch);
                    lineHasContent = true;
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted field in CSV");
        }
        if (lineHasContent || field.length() > 0) {
            current.add(field.toString());
            lines.add(current);
        }
        return lines;
    }
}
