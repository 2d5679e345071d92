package pvcmigrator.session;

import io.fabric8.kubernetes.api.model.APIGroup;
import io.fabric8.kubernetes.api.model.APIGroupList;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectRulesReview;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectRulesReviewBuilder;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.User;
import io.fabric8.openshift.client.OpenShiftClient;
import io.fabric8.openshift.client.OpenShiftConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pvcmigrator.exceptions.AuthException;

import javax.net.ssl.SSLException;
import java.net.HttpURLConnection;

/**
 * Builds isolated fabric8 clients and verifies them before use.
 *
 * <p>A client is built from an empty {@link Config}, so no kubeconfig file or
 * in-cluster context leaks into the session. Clients are OpenShift clients:
 * for a username/password login they exchange the password for an OAuth
 * token on the cluster's OAuth server, as {@code oc login} does, and fall
 * back to plain basic auth elsewhere. Verification runs capability
 * discovery (API group list) and an identity check: the OpenShift user API
 * when the cluster serves it, otherwise a {@code SelfSubjectRulesReview}.
 * On any failure the client is closed before the exception propagates.
 */
public class ClusterSessions implements ClusterSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(ClusterSessions.class);

    static final String OPENSHIFT_USER_GROUP = "user.openshift.io";

    @Override
    public ClusterSession open(ClusterRole role, ClusterEndpoint endpoint) throws AuthException {
        if (endpoint == null || endpoint.apiUrl() == null) {
            throw new AuthException(role + " API URL is missing", AuthException.Reason.INCOMPLETE);
        }
        if (!endpoint.hasToken() && !endpoint.hasBasicAuth()) {
            throw new AuthException(role + " credentials are incomplete: need a token or username/password",
                    AuthException.Reason.INCOMPLETE);
        }

        OpenShiftClient client = newClient(endpoint);
        try {
            verify(role, client);
        } catch (AuthException | RuntimeException e) {
            client.close();
            throw e;
        }
        log.info("{} login validated ({})", role, endpoint);
        return new KubernetesClusterSession(role, endpoint.apiUrl(), client);
    }

    static OpenShiftClient newClient(ClusterEndpoint endpoint) {
        return new KubernetesClientBuilder().withConfig(toConfig(endpoint)).build().adapt(OpenShiftClient.class);
    }

    static OpenShiftConfig toConfig(ClusterEndpoint endpoint) {
        ConfigBuilder builder = new ConfigBuilder(Config.empty())
                .withMasterUrl(endpoint.apiUrl())
                .withTrustCerts(endpoint.insecure())
                .withDisableHostnameVerification(endpoint.insecure());
        if (endpoint.hasToken()) {
            builder.withOauthToken(endpoint.token());
        } else {
            builder.withUsername(endpoint.username()).withPassword(endpoint.password());
        }
        return OpenShiftConfig.wrap(builder.build());
    }

    private static void verify(ClusterRole role, OpenShiftClient client) throws AuthException {
        try {
            APIGroupList groups = client.getApiGroups();
            if (groups == null) {
                throw new AuthException(role + " API discovery returned nothing", AuthException.Reason.REJECTED);
            }
            boolean openshift = groups.getGroups().stream().map(APIGroup::getName).anyMatch(OPENSHIFT_USER_GROUP::equals);
            if (openshift) {
                User user = client.currentUser();
                if (user == null || user.getMetadata() == null) {
                    throw new AuthException(role + " identity check failed", AuthException.Reason.REJECTED);
                }
            } else {
                SelfSubjectRulesReview review = client.authorization().v1().selfSubjectRulesReview()
                        .create(new SelfSubjectRulesReviewBuilder().withNewSpec().withNamespace("default").endSpec().build());
                if (review == null) {
                    throw new AuthException(role + " identity check failed", AuthException.Reason.REJECTED);
                }
            }
        } catch (KubernetesClientException e) {
            throw classify(role, e);
        }
    }

    static AuthException classify(ClusterRole role, KubernetesClientException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SSLException) {
                return new AuthException(role + " TLS verification failed: " + t.getMessage(),
                        AuthException.Reason.UNTRUSTED, e);
            }
        }
        if (e.getCode() == HttpURLConnection.HTTP_UNAUTHORIZED || e.getCode() == HttpURLConnection.HTTP_FORBIDDEN) {
            return new AuthException(role + " credentials rejected (HTTP " + e.getCode() + ")",
                    AuthException.Reason.REJECTED, e);
        }
        return new AuthException(role + " login failed: " + e.getMessage(), AuthException.Reason.REJECTED, e);
    }
}
