package work.gpflow.kernel.check;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of named predicates understood by {@link CheckDispatcher}.
 */
public enum Condition {
    FILE_PATH_VALID("IsFilePathValid"),
    FOLDER_PATH_VALID("IsFolderPathValid"),
    FILE_PATH_HAS_VALID_FOLDER("DoesFilePathHaveAValidFolder"),
    VALUE_IN_SET("IsValueInSet"),
    /** Input reference: the ID must already be registered. */
    ID_EXISTING("IsIdExisting"),
    /** Output collision: the ID must be free unless the collision policy replaces. */
    OUTPUT_ID_AVAILABLE("IsIdUnique"),
    CRS_MATCH("DoGeoLayerIDsHaveMatchingCRS"),
    GEOMETRY_KIND("DoesGeoLayerIdHaveCorrectGeometry"),
    CRS_CODE_VALID("IsCRSCodeValid"),
    INT_IN_RANGE("IsIntBetweenRange"),
    LIST_LENGTH_CORRECT("IsListLengthCorrect"),
    PROPERTY_UNIQUE("IsPropertyUnique"),
    ATTRIBUTES_EXIST("DoAttributesExist"),
    URL_VALID("IsUrlValid");

    private final String externalName;

    Condition(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    public static Optional<Condition> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(condition -> condition.externalName.equals(name)).findFirst();
    }
}
