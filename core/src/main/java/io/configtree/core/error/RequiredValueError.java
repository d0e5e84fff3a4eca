package io.configtree.core.error;

/** Thrown when a required key is missing from an enabled group after all layers are merged. */
public final class RequiredValueError extends ConfigValidationException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public RequiredValueError(String path, String key) {
        super("The child config \"" + key + "\" under \"" + path + "\" must be configured.", path);
        this.key = key;
    }

    /** The missing child key. */
    public String key() {
        return key;
    }
}
