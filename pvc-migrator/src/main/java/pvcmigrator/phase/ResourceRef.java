package pvcmigrator.phase;

/**
 * Coordinates of one namespaced custom resource.
 *
 * @param group API group, e.g. {@code automationcontroller.ansible.com}
 * @param version API version within the group, e.g. {@code v1beta1}
 * @param kind resource kind, e.g. {@code AutomationControllerBackup}
 * @param plural plural resource name used in API paths
 * @param namespace namespace of the resource
 * @param name metadata name
 */
public record ResourceRef(String group, String version, String kind, String plural, String namespace, String name) {

    public static final String AUTOMATION_CONTROLLER_GROUP = "automationcontroller.ansible.com";
    public static final String AUTOMATION_CONTROLLER_VERSION = "v1beta1";

    public static ResourceRef automationController(String kind, String namespace, String name) {
        return new ResourceRef(AUTOMATION_CONTROLLER_GROUP, AUTOMATION_CONTROLLER_VERSION, kind,
                kind.toLowerCase(java.util.Locale.ROOT) + "s", namespace, name);
    }

    /** {@code group/version}. */
    public String apiVersion() {
        return group + "/" + version;
    }

    /** {@code Kind namespace/name}, used in logs and exception messages. */
    @Override
    public String toString() {
        return kind + " " + namespace + "/" + name;
    }
}
