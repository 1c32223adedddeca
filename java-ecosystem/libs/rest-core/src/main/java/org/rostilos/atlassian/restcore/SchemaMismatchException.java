package org.rostilos.atlassian.restcore;

/**
 * Thrown when a fetched document carries a type tag other than the one its wrapper expects.
 */
public class SchemaMismatchException extends AtlassianClientException {

    private final String expectedType;
    private final String actualType;

    public SchemaMismatchException(String expectedType, String actualType) {
        super(String.format("Expected document of type '%s' but got '%s'", expectedType, actualType));
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }
}
