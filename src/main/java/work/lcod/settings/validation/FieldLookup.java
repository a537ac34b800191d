package work.lcod.settings.validation;

/**
 * Gives rules access to other declared variables (used by cross-field comparisons).
 */
public interface FieldLookup {
    boolean isDeclared(String name);

    Object valueOf(String name);

    static FieldLookup none() {
        return new FieldLookup() {
            @Override
            public boolean isDeclared(String name) {
                return false;
            }

            @Override
            public Object valueOf(String name) {
                throw new IllegalStateException("No other variables are visible to this validation");
            }
        };
    }
}
