package in.execguard.application.port.output;

import in.execguard.domain.connection.ConnectionDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Opens a new connection to one bridge instance.
 *
 * Called once per recovery attempt. The returned descriptor counts as a
 * connection only if its status is CONNECTED.
 */
@FunctionalInterface
public interface ConnectionFactory {
    CompletableFuture<ConnectionDescriptor> connect();
}
