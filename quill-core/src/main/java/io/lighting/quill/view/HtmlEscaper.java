package io.lighting.quill.view;

public final class HtmlEscaper {
    private HtmlEscaper() {
    }

    public static String escape(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder out = null;
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            String replacement = switch (ch) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&#x27;";
                case '/' -> "&#x2F;";
                default -> null;
            };
            if (replacement == null) {
                if (out != null) {
                    out.append(ch);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(input.length() + 16);
                out.append(input, 0, i);
            }
            out.append(replacement);
        }
        return out == null ? input : out.toString();
    }

    /**
     * Attribute values keep '/' readable so URLs survive inside quoted attributes.
     */
    public static String escapeAttribute(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(input.length() + 8);
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            switch (ch) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#x27;");
                default -> out.append(ch);
            }
        }
        return out.toString();
    }
}
