package org.routeflow.http.routing;

import java.util.ArrayList;
import java.util.List;

class GroupPrefixStack {

    private final List<String> prefixes = new ArrayList<>();

    /**
     * Pushes {@code prefix}; the returned scope pops it again when closed.
     */
    Scope open(String prefix) {
        prefixes.add(prefix);
        return new Scope(prefixes.size());
    }

    String apply(String path) {
        String result = String.join("", prefixes) + path;
        if (result.isEmpty() || result.charAt(0) != '/') {
            result = "/" + result;
        }
        return result;
    }

    final class Scope implements AutoCloseable {

        private final int depth;
        private boolean closed;

        private Scope(int depth) {
            this.depth = depth;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (prefixes.size() != depth) {
                throw new IllegalStateException("Group prefixes closed out of order: expected depth " + depth
                        + " but was " + prefixes.size());
            }
            prefixes.remove(prefixes.size() - 1);
        }
    }

}
