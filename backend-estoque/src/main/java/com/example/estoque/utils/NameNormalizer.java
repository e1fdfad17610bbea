package com.example.estoque.utils;

/**
 * Normalização dos nomes de produto e cliente: remove espaços nas pontas e
 * coloca em "title case" (primeira letra de cada palavra maiúscula, demais
 * minúsculas). Uma palavra começa em toda letra precedida por algo que não é
 * letra, então "coca-cola 2l" vira "Coca-Cola 2L".
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        StringBuilder sb = new StringBuilder(trimmed.length());
        boolean previousCased = false;
        int i = 0;
        while (i < trimmed.length()) {
            int cp = trimmed.codePointAt(i);
            boolean cased = Character.isUpperCase(cp) || Character.isLowerCase(cp) || Character.isTitleCase(cp);
            if (cased) {
                sb.appendCodePoint(previousCased ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
            } else {
                sb.appendCodePoint(cp);
            }
            previousCased = cased;
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    /**
     * Descrições só perdem os espaços das pontas; vazio vira null.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
