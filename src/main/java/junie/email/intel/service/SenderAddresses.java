package junie.email.intel.service;

import java.util.Locale;

/**
 * Normalization of sender addresses so that VIP, reputation and pattern keys agree.
 */
public final class SenderAddresses {

    private SenderAddresses() {
    }

    /**
     * Lower-cased bare address. Accepts {@code "Name <a@b.com>"} as well as {@code "a@b.com"}.
     */
    public static String normalize(String sender) {
        if (sender == null) {
            return "";
        }
        String value = sender.trim();
        int open = value.lastIndexOf('<');
        int close = value.lastIndexOf('>');
        if (open >= 0 && close > open) {
            value = value.substring(open + 1, close).trim();
        }
        return value.toLowerCase(Locale.ROOT);
    }

    /**
     * Registrable-looking domain: the last two labels, so {@code mail.shop.example.com} and
     * {@code news.example.com} both map to {@code example.com}.
     */
    public static String domain(String sender) {
        String address = normalize(sender);
        int at = address.lastIndexOf('@');
        if (at < 0 || at == address.length() - 1) {
            return "";
        }
        String host = address.substring(at + 1);
        String[] labels = host.split("\\.");
        if (labels.length <= 2) {
            return host;
        }
        return labels[labels.length - 2] + "." + labels[labels.length - 1];
    }

    public static String localPart(String sender) {
        String address = normalize(sender);
        int at = address.lastIndexOf('@');
        return at < 0 ? address : address.substring(0, at);
    }
}
