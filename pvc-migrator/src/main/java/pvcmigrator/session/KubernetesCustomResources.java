package pvcmigrator.session;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.KubernetesClientTimeoutException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import pvcmigrator.exceptions.MigrateException;
import pvcmigrator.exceptions.ResourceTimeoutException;
import pvcmigrator.phase.CustomResourceGateway;
import pvcmigrator.phase.ResourceRef;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Custom resources through the generic (untyped) fabric8 API.
 */
class KubernetesCustomResources implements CustomResourceGateway {

    private final KubernetesClient client;

    KubernetesCustomResources(KubernetesClient client) {
        this.client = client;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> status(ResourceRef ref) throws MigrateException {
        GenericKubernetesResource cr = get(ref);
        if (cr == null) {
            return Optional.empty();
        }
        Object status = cr.getAdditionalProperties().get("status");
        return Optional.of(status instanceof Map ? (Map<String, Object>) status : Map.of());
    }

    @Override
    public boolean exists(ResourceRef ref) throws MigrateException {
        return get(ref) != null;
    }

    @Override
    public void delete(ResourceRef ref, Duration timeout) throws MigrateException {
        try {
            Resource<GenericKubernetesResource> resource = operation(ref).inNamespace(ref.namespace()).withName(ref.name());
            resource.delete();
            resource.waitUntilCondition(Objects::isNull, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (KubernetesClientTimeoutException e) {
            throw new ResourceTimeoutException(ref.toString(), timeout, "still present after delete");
        } catch (KubernetesClientException e) {
            throw new MigrateException("Delete failed: " + e.getMessage(), null, ref.toString(), e);
        }
    }

    @Override
    public void create(ResourceRef ref, Map<String, Object> spec) throws MigrateException {
        GenericKubernetesResource cr = new GenericKubernetesResourceBuilder()
                .withApiVersion(ref.apiVersion())
                .withKind(ref.kind())
                .withNewMetadata()
                    .withName(ref.name())
                    .withNamespace(ref.namespace())
                .endMetadata()
                .build();
        cr.setAdditionalProperty("spec", spec);
        try {
            operation(ref).inNamespace(ref.namespace()).resource(cr).create();
        } catch (KubernetesClientException e) {
            throw new MigrateException("Create failed: " + e.getMessage(), null, ref.toString(), e);
        }
    }

    private GenericKubernetesResource get(ResourceRef ref) throws MigrateException {
        try {
            return operation(ref).inNamespace(ref.namespace()).withName(ref.name()).get();
        } catch (KubernetesClientException e) {
            throw new MigrateException("Read failed: " + e.getMessage(), null, ref.toString(), e);
        }
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation(
            ResourceRef ref) {
        ResourceDefinitionContext context = new ResourceDefinitionContext.Builder()
                .withGroup(ref.group())
                .withVersion(ref.version())
                .withKind(ref.kind())
                .withPlural(ref.plural())
                .withNamespaced(true)
                .build();
        return client.genericKubernetesResources(context);
    }
}
