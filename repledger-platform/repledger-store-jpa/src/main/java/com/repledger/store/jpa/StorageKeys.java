package com.repledger.store.jpa;

/**
 * Escapes ledger keys for text columns, which cannot hold the NUL part separator.
 * The mapping is reversible and keeps prefixes as prefixes.
 */
final class StorageKeys {

    private StorageKeys() {
    }

    static String encode(String key) {
        StringBuilder out = new StringBuilder(key.length() + 8);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            switch (c) {
                case '%' -> out.append("%25");
                case '\u0000' -> out.append("%00");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    static String decode(String stored) {
        StringBuilder out = new StringBuilder(stored.length());
        for (int i = 0; i < stored.length(); i++) {
            char c = stored.charAt(i);
            if (c == '%' && i + 2 < stored.length()) {
                String code = stored.substring(i + 1, i + 3);
                out.append("00".equals(code) ? '\u0000' : '%');
                i += 2;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
