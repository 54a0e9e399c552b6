package io.ledgerrest.api.trap;

import io.ledgerrest.core.message.MessageType;
import io.ledgerrest.core.message.ReplyStatus;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a validator reply status into a client error, or lets it through.
 *
 * <p>
 * The chain for one reply is the endpoint's own traps, in the order given,
 * followed by the baseline traps every endpoint shares:
 * <ul>
 *   <li>{@code INTERNAL_ERROR} - unknown validator error (500)</li>
 *   <li>{@code NOT_READY} - validator not ready (503)</li>
 *   <li>{@code NO_ROOT} - head not found (404)</li>
 * </ul>
 * A baseline trap joins the chain only when the reply type can carry its
 * status. The first trap that matches throws; a status nothing matches
 * (including {@code OK}) returns normally.
 */
public final class TrapChain {

    private TrapChain() {
        // Utility class
    }

    /**
     * @param replyType     the type of the reply being checked
     * @param status        the status the validator sent
     * @param endpointTraps traps specific to the calling endpoint
     * @throws io.ledgerrest.core.error.ApiException if a trap matches
     */
    public static void check(final MessageType replyType, final ReplyStatus status, final List<ErrorTrap> endpointTraps) {
        for (ErrorTrap trap : chain(replyType, endpointTraps)) {
            trap.check(status);
        }
    }

    public static void check(final MessageType replyType, final ReplyStatus status, final ErrorTrap... endpointTraps) {
        check(replyType, status, List.of(endpointTraps));
    }

    /**
     * @return the traps checked for a reply of {@code replyType}, in order
     */
    static List<ErrorTrap> chain(final MessageType replyType, final List<ErrorTrap> endpointTraps) {
        final List<ErrorTrap> traps = new ArrayList<>(endpointTraps);
        for (ErrorTrap baseline : List.of(ErrorTraps.unknown(), ErrorTraps.notReady(), ErrorTraps.missingHead())) {
            if (replyType.supports(baseline.trigger())) {
                traps.add(baseline);
            }
        }
        return traps;
    }
}
