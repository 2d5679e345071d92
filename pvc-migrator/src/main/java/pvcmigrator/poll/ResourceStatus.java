package pvcmigrator.poll;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of a custom resource's {@code status} block.
 *
 * <p>Holds the status and reason of one named condition plus the remaining
 * top-level status fields (for example {@code backupDirectory} or
 * {@code restoreComplete}). Missing values are null rather than empty strings.
 *
 * @param conditionStatus status of the watched condition ({@code True}, {@code False}, {@code Unknown}), or null
 * @param conditionReason reason of the watched condition, or null
 * @param fields other top-level status fields, never null
 */
public record ResourceStatus(String conditionStatus, String conditionReason, Map<String, Object> fields) {

    public static final ResourceStatus EMPTY = new ResourceStatus(null, null, Map.of());

    public ResourceStatus {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Decodes a raw {@code status} map as returned by the API server.
     *
     * @param status the raw status object, may be null
     * @param conditionType the condition {@code type} to extract
     */
    @SuppressWarnings("unchecked")
    public static ResourceStatus decode(Map<String, Object> status, String conditionType) {
        if (status == null) {
            return EMPTY;
        }
        String condStatus = null;
        String condReason = null;
        Object conditions = status.get("conditions");
        if (conditions instanceof List) {
            for (Object c : (List<Object>) conditions) {
                if (c instanceof Map) {
                    Map<String, Object> cond = (Map<String, Object>) c;
                    if (Objects.equals(conditionType, stringOrNull(cond.get("type")))) {
                        condStatus = stringOrNull(cond.get("status"));
                        condReason = stringOrNull(cond.get("reason"));
                        break;
                    }
                }
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        status.forEach((k, v) -> {
            if (!"conditions".equals(k) && v != null) {
                fields.put(k, v);
            }
        });
        return new ResourceStatus(condStatus, condReason, fields);
    }

    /** A top-level status field rendered as a non-blank string. */
    public Optional<String> field(String name) {
        Object v = fields.get(name);
        if (v == null) {
            return Optional.empty();
        }
        String s = v.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    /** True if the field is boolean {@code true} or the string {@code "true"}. */
    public boolean isTrue(String name) {
        Object v = fields.get(name);
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        return v != null && "true".equalsIgnoreCase(v.toString().trim());
    }

    /** One-line rendering for poll logs. */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append("status=").append(conditionStatus != null ? conditionStatus : "<none>")
                .append(" reason=").append(conditionReason != null ? conditionReason : "<none>");
        fields.forEach((k, v) -> {
            if (!(v instanceof Map) && !(v instanceof List)) {
                sb.append(' ').append(k).append('=').append(v);
            }
        });
        return sb.toString();
    }

    private static String stringOrNull(Object o) {
        return o == null ? null : o.toString();
    }
}
