package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.TicketGrant;
import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.RemoteCallException;
import io.github.drompincen.fieldsync.runtime.support.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Obtains upload tickets and performs the direct-to-storage write. Response entries are matched
 * to packages by digest only, since the server may reorder or omit them.
 */
@Component
public class UploadTicketClient {

    private static final Logger log = LoggerFactory.getLogger(UploadTicketClient.class);

    private final FieldServerClient client;

    public UploadTicketClient(FieldServerClient client) {
        this.client = client;
    }

    /**
     * One ticket request for the whole batch.
     *
     * @throws RemoteCallException when the request itself fails
     */
    public TicketAssignment requestTickets(String taskUid, String targetProjectUid, List<UploadPackage> packages) {
        List<TicketGrant> grants = client.createUploadTask(taskUid, targetProjectUid, packages);

        Set<String> wanted = new HashSet<>();
        packages.forEach(p -> wanted.add(p.packageDigest()));

        Map<String, UploadTicket> matched = new HashMap<>();
        List<String> stray = new ArrayList<>();
        for (TicketGrant grant : grants) {
            String digest = grant.packageDigest();
            if (digest == null || !wanted.contains(digest)) {
                log.warn("Task {} returned a ticket for unknown digest {} (event {})", taskUid, digest, grant.eventUid());
                stray.add(String.valueOf(digest));
                continue;
            }
            if (matched.putIfAbsent(digest, grant.ticket()) != null) {
                log.warn("Task {} returned more than one ticket for digest {}, keeping the first", taskUid, digest);
            }
        }

        List<UploadPackage> unmatched = new ArrayList<>();
        for (UploadPackage pkg : packages) {
            if (!matched.containsKey(pkg.packageDigest())) {
                log.warn("Task {} returned no ticket for event {} (digest {})", taskUid, pkg.eventUid(), pkg.packageDigest());
                unmatched.add(pkg);
            }
        }
        log.info("Task {}: {} of {} package(s) ticketed", taskUid, packages.size() - unmatched.size(), packages.size());
        return new TicketAssignment(matched, unmatched, stray);
    }

    /**
     * Per-package ticket, for packages the batch response left out.
     *
     * @throws RemoteCallException when the request fails
     */
    public UploadTicket requestTicket(UploadPackage uploadPackage) {
        return client.requestUploadTicket(uploadPackage.archiveName(), uploadPackage.packageDigest());
    }

    /** Uploads the archive to the ticket's host. Never throws for item-level failures. */
    public UploadOutcome upload(UploadPackage uploadPackage, Path archive, UploadTicket ticket) {
        String eventUid = uploadPackage.eventUid();
        String digest = uploadPackage.packageDigest();
        if (archive == null || !Files.isRegularFile(archive)) {
            return UploadOutcome.failed(eventUid, digest, "zip file not found: " + archive);
        }
        try {
            String actual = Digests.sha256Hex(archive);
            if (!actual.equals(digest)) {
                return UploadOutcome.failed(eventUid, digest, "hash mismatch: expected " + digest + ", actual " + actual);
            }
        } catch (IOException e) {
            return UploadOutcome.failed(eventUid, digest, "cannot read archive: " + e.getMessage());
        }
        try {
            client.uploadToStorage(ticket, archive);
            log.debug("Uploaded event {} as {}", eventUid, ticket.objectKey());
            return UploadOutcome.uploaded(eventUid, digest);
        } catch (RemoteCallException e) {
            log.warn("Upload of event {} failed: {}", eventUid, e.getMessage());
            return UploadOutcome.failed(eventUid, digest, e.getMessage());
        }
    }
}
