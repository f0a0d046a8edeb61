package org.csu.svrf2pxl.cli.tool;

import java.util.ArrayList;
import java.util.List;

/**
 * 将行数据格式化为带边框的控制台表格。
 */
public final class ConsoleTable {

    private ConsoleTable() {
    }

    /**
     * @param headers 表头
     * @param rows    每行的单元格, null 显示为空
     * @return 不带结尾换行的表格字符串
     */
    public static String format(List<String> headers, List<List<String>> rows) {
        List<Integer> widths = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            int width = headers.get(i).length();
            for (List<String> row : rows) {
                if (i < row.size()) {
                    width = Math.max(width, cell(row.get(i)).length());
                }
            }
            widths.add(width);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(separator(widths)).append("\n");
        sb.append(row(headers, widths)).append("\n");
        sb.append(separator(widths)).append("\n");
        for (List<String> row : rows) {
            sb.append(row(row, widths)).append("\n");
        }
        sb.append(separator(widths));
        return sb.toString();
    }

    private static String cell(String value) {
        return value == null ? "" : value;
    }

    private static String row(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.size(); i++) {
            String value = i < cells.size() ? cell(cells.get(i)) : "";
            sb.append(String.format(" %-" + widths.get(i) + "s |", value));
        }
        return sb.toString();
    }

    private static String separator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
