package ai.catalog.translator.pipeline;

/**
 * No registered service or provider offers the requested name.
 */
public class ServiceNotFoundException extends RuntimeException {

    public ServiceNotFoundException(String service) {
        super("Service '" + service + "' not found");
    }
}
