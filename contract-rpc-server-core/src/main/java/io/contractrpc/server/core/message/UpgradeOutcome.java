package io.contractrpc.server.core.message;

import io.contractrpc.server.core.ServerResponse;

/**
 * Result of {@link MessageRouter#upgrade}: either accept the upgrade or answer with a plain HTTP response.
 */
public sealed interface UpgradeOutcome permits UpgradeOutcome.Accepted, UpgradeOutcome.Rejected {

    record Accepted(UpgradeResult result) implements UpgradeOutcome {}

    record Rejected(ServerResponse response) implements UpgradeOutcome {}
}
