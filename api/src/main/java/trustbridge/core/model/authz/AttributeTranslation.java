package trustbridge.core.model.authz;

/**
 * A clearance rewrite applied for the owning instance.
 *
 * @param mappingInstance instance whose mapping table was consulted
 */
public record AttributeTranslation(String originalClearance, String translatedClearance, String mappingInstance) {

    public boolean changed() {
        return !originalClearance.equals(translatedClearance);
    }
}
