package pvcmigrator.volume;

import io.fabric8.kubernetes.api.model.Quantity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ProvisioningException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the destination claim spec from the source claim and makes sure the
 * destination claim exists.
 *
 * <h2>Resolution rules</h2>
 * <ul>
 *   <li>Storage class: the source class if the destination has it, else the
 *       destination default class, else none (cluster defaulting, with a warning)</li>
 *   <li>Capacity: the source request, else the configured fallback (with a warning)</li>
 *   <li>Access modes: the source set, else {@code ReadWriteOnce}</li>
 *   <li>Volume mode: the source mode, else {@code Filesystem}</li>
 * </ul>
 *
 * <p>An existing destination claim is reused only when its capacity, access
 * modes and volume mode equal the resolved spec; otherwise the run fails
 * before any pod is launched.
 */
public class VolumeProvisioningResolver {

    private static final Logger log = LoggerFactory.getLogger(VolumeProvisioningResolver.class);

    public static final String DEFAULT_ACCESS_MODE = "ReadWriteOnce";
    public static final String DEFAULT_VOLUME_MODE = "Filesystem";

    private final String fallbackCapacity;

    public VolumeProvisioningResolver(String fallbackCapacity) {
        this.fallbackCapacity = Objects.requireNonNull(fallbackCapacity, "fallbackCapacity");
    }

    /**
     * Resolves the destination spec for {@code sourceClaim}.
     *
     * @param source gateway of the source cluster
     * @param sourceNamespace namespace of the source claim
     * @param sourceClaim name of the source claim
     * @param destination gateway of the destination cluster
     */
    public VolumeResolution resolve(VolumeGateway source, String sourceNamespace, String sourceClaim,
                                    VolumeGateway destination) throws MigrateException {
        List<String> warnings = new ArrayList<>();
        Optional<ClaimSnapshot> snapshot = source.read(sourceNamespace, sourceClaim);
        if (snapshot.isEmpty()) {
            warn(warnings, "source claim " + sourceNamespace + "/" + sourceClaim + " not found; using defaults");
        }
        ClaimSnapshot claim = snapshot.orElse(new ClaimSnapshot(sourceNamespace, sourceClaim, null, List.of(), null, null, null));

        String capacity = claim.requestedCapacity();
        if (isBlank(capacity)) {
            warn(warnings, "could not read source claim size; defaulting to " + fallbackCapacity);
            capacity = fallbackCapacity;
        }

        Set<String> modes = new LinkedHashSet<>();
        for (String m : claim.accessModes()) {
            if (!isBlank(m)) {
                modes.add(m.trim());
            }
        }
        if (modes.isEmpty()) {
            modes.add(DEFAULT_ACCESS_MODE);
        }

        String volumeMode = isBlank(claim.volumeMode()) ? DEFAULT_VOLUME_MODE : claim.volumeMode();

        String storageClass = null;
        StorageClassSource scSource;
        if (!isBlank(claim.storageClass()) && storageClassExists(destination, claim.storageClass(), warnings)) {
            storageClass = claim.storageClass();
            scSource = StorageClassSource.SOURCE_MATCH;
        } else {
            Optional<String> def = defaultStorageClass(destination, warnings);
            if (def.isPresent()) {
                storageClass = def.get();
                scSource = StorageClassSource.DESTINATION_DEFAULT;
            } else {
                scSource = StorageClassSource.CLUSTER_DEFAULT;
                warn(warnings, "could not detect default StorageClass on destination; claim will use cluster default");
            }
        }

        VolumeSpec spec = new VolumeSpec(capacity, modes, volumeMode, storageClass, scSource);
        log.info("Resolved destination volume from {}/{}: {}", sourceNamespace, sourceClaim, spec);
        return new VolumeResolution(spec, warnings);
    }

    /**
     * Creates the destination claim, or validates and reuses an existing one.
     *
     * @throws ProvisioningException if an existing claim does not match or creation fails
     */
    public ProvisioningOutcome ensure(VolumeGateway destination, String namespace, String name, VolumeSpec spec)
            throws MigrateException {
        String resource = "PersistentVolumeClaim " + namespace + "/" + name;
        Optional<ClaimSnapshot> existing = destination.read(namespace, name);
        if (existing.isPresent()) {
            List<String> mismatches = mismatches(existing.get(), spec);
            if (!mismatches.isEmpty()) {
                throw new ProvisioningException("Existing destination claim is incompatible: "
                        + String.join("; ", mismatches), resource);
            }
            log.info("Destination claim {} already exists and matches. Skipping creation.", resource);
            return ProvisioningOutcome.REUSED;
        }

        log.info("Creating destination claim {} ({})", resource, spec);
        try {
            destination.create(namespace, name, spec);
        } catch (ProvisioningException e) {
            throw e;
        } catch (MigrateException | RuntimeException e) {
            throw new ProvisioningException("Failed to create destination claim: " + e.getMessage(), resource, e);
        }
        log.info("Destination claim {} is Created.", resource);
        return ProvisioningOutcome.CREATED;
    }

    // A failed lookup counts as "not found" so resolution moves on to the next option.
    private static boolean storageClassExists(VolumeGateway destination, String name, List<String> warnings) {
        try {
            return destination.storageClassExists(name);
        } catch (MigrateException | RuntimeException e) {
            warn(warnings, "could not look up StorageClass " + name + " on destination: " + e.getMessage());
            return false;
        }
    }

    private static Optional<String> defaultStorageClass(VolumeGateway destination, List<String> warnings) {
        try {
            return destination.defaultStorageClass();
        } catch (MigrateException | RuntimeException e) {
            warn(warnings, "could not list StorageClasses on destination: " + e.getMessage());
            return Optional.empty();
        }
    }

    static List<String> mismatches(ClaimSnapshot existing, VolumeSpec spec) {
        List<String> problems = new ArrayList<>();
        if (!sameQuantity(existing.requestedCapacity(), spec.capacity())) {
            problems.add("capacity " + existing.requestedCapacity() + " != " + spec.capacity());
        }
        Set<String> existingModes = new LinkedHashSet<>(existing.accessModes());
        if (existingModes.isEmpty()) {
            existingModes.add(DEFAULT_ACCESS_MODE);
        }
        if (!existingModes.equals(spec.accessModes())) {
            problems.add("accessModes " + existingModes + " != " + spec.accessModes());
        }
        String existingMode = isBlank(existing.volumeMode()) ? DEFAULT_VOLUME_MODE : existing.volumeMode();
        if (!existingMode.equals(spec.volumeMode())) {
            problems.add("volumeMode " + existingMode + " != " + spec.volumeMode());
        }
        return problems;
    }

    static boolean sameQuantity(String a, String b) {
        if (isBlank(a) || isBlank(b)) {
            return false;
        }
        try {
            BigDecimal left = Quantity.getAmountInBytes(new Quantity(a.trim()));
            BigDecimal right = Quantity.getAmountInBytes(new Quantity(b.trim()));
            return left.compareTo(right) == 0;
        } catch (IllegalArgumentException | ArithmeticException e) {
            return a.trim().equals(b.trim());
        }
    }

    private static void warn(List<String> warnings, String message) {
        log.warn("{}", message);
        warnings.add(message);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
