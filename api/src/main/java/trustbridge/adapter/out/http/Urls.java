package trustbridge.adapter.out.http;

import java.net.URI;

final class Urls {

    private Urls() {}

    static String join(URI base, String path) {
        final var text = base.toString();
        return (text.endsWith("/") ? text.substring(0, text.length() - 1) : text) + path;
    }
}
