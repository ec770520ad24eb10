package com.afsun.transpiler.core.mapping;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Oracle/PostgreSQL 风格日期格式（YYYY-MM-DD HH24:MI:SS）与 MySQL 风格（%Y-%m-%d %H:%i:%s）互转
 *
 * @author afsun
 */
public final class DateFormatMapper {

    /**
     * 按长度优先排列，避免 MM 抢先匹配 MON
     */
    private static final List<String[]> ORACLE_TO_MYSQL = Collections.unmodifiableList(Arrays.asList(
            new String[]{"YYYY", "%Y"},
            new String[]{"MONTH", "%M"},
            new String[]{"HH24", "%H"},
            new String[]{"HH12", "%h"},
            new String[]{"FF6", "%f"},
            new String[]{"FF3", "%f"},
            new String[]{"MON", "%b"},
            new String[]{"DAY", "%W"},
            new String[]{"DDD", "%j"},
            new String[]{"YY", "%y"},
            new String[]{"MM", "%m"},
            new String[]{"DD", "%d"},
            new String[]{"DY", "%a"},
            new String[]{"HH", "%h"},
            new String[]{"MI", "%i"},
            new String[]{"SS", "%s"},
            new String[]{"FF", "%f"},
            new String[]{"AM", "%p"},
            new String[]{"PM", "%p"},
            new String[]{"IW", "%v"}
    ));

    private static final Map<Character, String> MYSQL_TO_ORACLE;

    static {
        Map<Character, String> m = new LinkedHashMap<>();
        m.put('Y', "YYYY");
        m.put('y', "YY");
        m.put('m', "MM");
        m.put('c', "FMMM");
        m.put('M', "MONTH");
        m.put('b', "MON");
        m.put('d', "DD");
        m.put('e', "FMDD");
        m.put('H', "HH24");
        m.put('k', "HH24");
        m.put('h', "HH12");
        m.put('I', "HH12");
        m.put('l', "HH12");
        m.put('i', "MI");
        m.put('s', "SS");
        m.put('S', "SS");
        m.put('f', "FF6");
        m.put('p', "AM");
        m.put('W', "DAY");
        m.put('a', "DY");
        m.put('j', "DDD");
        m.put('v', "IW");
        m.put('T', "HH24:MI:SS");
        MYSQL_TO_ORACLE = Collections.unmodifiableMap(m);
    }

    private DateFormatMapper() {
    }

    /**
     * 格式串中是否包含日期时间元素（用于区分 TO_CHAR 的数字格式）
     */
    public static boolean looksLikeDateFormat(String oracleFormat) {
        String upper = oracleFormat.toUpperCase(Locale.ROOT);
        for (String[] token : ORACLE_TO_MYSQL) {
            if (upper.contains(token[0])) {
                return true;
            }
        }
        return false;
    }

    public static String oracleToMySql(String format) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '"') {
                // 双引号内是原样输出的文本
                int close = format.indexOf('"', i + 1);
                int end = close < 0 ? format.length() : close;
                sb.append(format.substring(i + 1, end).replace("%", "%%"));
                i = end + 1;
                continue;
            }
            String matched = null;
            for (String[] token : ORACLE_TO_MYSQL) {
                if (format.regionMatches(true, i, token[0], 0, token[0].length())) {
                    matched = token[0];
                    sb.append(token[1]);
                    break;
                }
            }
            if (matched != null) {
                i += matched.length();
                continue;
            }
            if (format.regionMatches(true, i, "FM", 0, 2)) {
                // MySQL 没有填充模式开关
                i += 2;
                continue;
            }
            sb.append(c == '%' ? "%%" : String.valueOf(c));
            i++;
        }
        return sb.toString();
    }

    public static String mySqlToOracle(String format) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                char spec = format.charAt(i + 1);
                String mapped = MYSQL_TO_ORACLE.get(spec);
                if (mapped != null) {
                    sb.append(mapped);
                } else if (spec == '%') {
                    sb.append('%');
                } else {
                    sb.append('"').append(spec).append('"');
                }
                i += 2;
                continue;
            }
            if (Character.isLetter(c)) {
                // 普通字母在 Oracle 格式里需要加引号，否则会被当作格式元素
                int j = i;
                while (j < format.length() && Character.isLetter(format.charAt(j))) {
                    j++;
                }
                sb.append('"').append(format, i, j).append('"');
                i = j;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }
}
