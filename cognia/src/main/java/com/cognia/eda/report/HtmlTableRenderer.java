package com.cognia.eda.report;

import org.springframework.stereotype.Component;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

/**
 * Renders a header row plus data rows as an HTML table with the report's table
 * class. Headers are shown with underscores as spaces in title case.
 */
@Component
public class HtmlTableRenderer {

    static final String NO_DATA = "<p><i>No data available</i></p>";

    private static final int MAX_DIGITS = 6;

    public String render(List<String> headers, List<? extends List<?>> rows) {
        if (headers == null || headers.isEmpty() || rows == null || rows.isEmpty()) {
            return NO_DATA;
        }
        StringBuilder html = new StringBuilder();
        html.append("<table class=\"table\">\n<thead>\n<tr>");
        for (String header : headers) {
            html.append("<th>").append(escapeHtml(headerLabel(header))).append("</th>");
        }
        html.append("</tr>\n</thead>\n<tbody>\n");
        for (List<?> row : rows) {
            html.append("<tr>");
            for (Object cell : row) {
                html.append("<td>").append(escapeHtml(formatValue(cell))).append("</td>");
            }
            html.append("</tr>\n");
        }
        html.append("</tbody>\n</table>");
        return html.toString();
    }

    static String headerLabel(String raw) {
        String spaced = raw.replace('_', ' ');
        StringBuilder label = new StringBuilder(spaced.length());
        boolean startOfWord = true;
        for (char c : spaced.toCharArray()) {
            label.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
            startOfWord = !Character.isLetter(c);
        }
        return label.toString();
    }

    /**
     * Numbers with more than six integer digits switch to scientific notation so
     * wide values do not stretch the table.
     */
    static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                return "NaN";
            }
            if (Double.isInfinite(number)) {
                return number > 0 ? "inf" : "-inf";
            }
            DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
            if (Math.abs(number) >= Math.pow(10, MAX_DIGITS)) {
                return new DecimalFormat("0.##E0", symbols).format(number);
            }
            return new DecimalFormat("#,##0.###", symbols).format(number);
        }
        return value.toString();
    }

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
