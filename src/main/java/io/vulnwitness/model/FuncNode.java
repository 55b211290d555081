package io.vulnwitness.model;

/**
 * A function or method in the analyzed program's call graph.
 * <p>
 * Nodes do not hold references to their call sites. Incoming and outgoing
 * call sites are looked up by {@link #id()} in the owning {@link CallGraph}.
 *
 * @param id          Identifier, unique within one {@link Result}
 * @param name        Function or method name (e.g., "Parse")
 * @param receiver    Receiver type name for methods, null for plain functions
 * @param packagePath Path of the declaring package (e.g., "golang.org/x/text/language")
 * @param position    Declaration position, null for synthetic or unknown functions
 */
public record FuncNode(
        int id,
        String name,
        String receiver,
        String packagePath,
        SourcePosition position
) {
    /**
     * Compact constructor with validation.
     */
    public FuncNode {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be null or blank");
        }
        if (packagePath == null) {
            packagePath = "";
        }
        if (receiver != null && receiver.isBlank()) {
            receiver = null;
        }
    }

    /**
     * Package and receiver qualified name, e.g. "pkg/path.Type.Method" or "pkg/path.Func".
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        if (!packagePath.isEmpty()) {
            sb.append(packagePath).append('.');
        }
        if (receiver != null) {
            sb.append(receiver).append('.');
        }
        return sb.append(name).toString();
    }

    public boolean isMethod() {
        return receiver != null;
    }

    public boolean hasPosition() {
        return position != null;
    }

    @Override
    public String toString() {
        return displayName();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int id;
        private String name;
        private String receiver;
        private String packagePath;
        private SourcePosition position;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder receiver(String receiver) {
            this.receiver = receiver;
            return this;
        }

        public Builder packagePath(String packagePath) {
            this.packagePath = packagePath;
            return this;
        }

        public Builder position(SourcePosition position) {
            this.position = position;
            return this;
        }

        public Builder position(String filename, int line, int column) {
            return position(new SourcePosition(filename, line, column));
        }

        public FuncNode build() {
            return new FuncNode(id, name, receiver, packagePath, position);
        }
    }
}
