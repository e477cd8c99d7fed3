package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tickets matched to packages by digest. {@code unmatched} are packages the server returned no
 * ticket for; {@code strayDigests} are response entries that matched no package.
 */
public record TicketAssignment(
        Map<String, UploadTicket> ticketsByDigest,
        List<UploadPackage> unmatched,
        List<String> strayDigests
) {
    public TicketAssignment {
        ticketsByDigest = Map.copyOf(ticketsByDigest);
        unmatched = List.copyOf(unmatched);
        strayDigests = List.copyOf(strayDigests);
    }

    public Optional<UploadTicket> ticketFor(UploadPackage uploadPackage) {
        return Optional.ofNullable(ticketsByDigest.get(uploadPackage.packageDigest()));
    }
}
