package io.github.drompincen.fieldsync.persistence.store;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.persistence.repository.AssetNodeRepository;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class MongoAssetNodeStore implements AssetNodeStore {

    private final MongoTemplate mongoTemplate;
    private final AssetNodeRepository assetNodeRepository;

    public MongoAssetNodeStore(MongoTemplate mongoTemplate, AssetNodeRepository assetNodeRepository) {
        this.mongoTemplate = mongoTemplate;
        this.assetNodeRepository = assetNodeRepository;
    }

    @Override
    public Optional<AssetNodeDocument> findById(String nodeId) {
        return assetNodeRepository.findById(nodeId);
    }

    @Override
    public Optional<AssetNodeDocument> findByRemoteId(String remoteId) {
        return assetNodeRepository.findByRemoteId(remoteId);
    }

    @Override
    public List<AssetNodeDocument> findByOwner(String projectUid) {
        return assetNodeRepository.findByOwningProjectUidsContaining(projectUid);
    }

    @Override
    public List<AssetNodeDocument> findByOwnerAndStatus(String projectUid, AssetDownloadStatus status) {
        return assetNodeRepository.findByOwningProjectUidsContainingAndDownloadStatus(projectUid, status);
    }

    @Override
    public AssetNodeDocument insert(AssetNodeDocument node) {
        Instant now = Instant.now();
        if (node.getCreatedAt() == null) {
            node.setCreatedAt(now);
        }
        node.setUpdatedAt(now);
        return mongoTemplate.insert(node);
    }

    @Override
    public Optional<AssetNodeDocument> addOwner(String nodeId, String projectUid) {
        Update update = new Update()
                .addToSet("owningProjectUids", projectUid)
                .set("updatedAt", Instant.now());
        return modify(nodeId, update);
    }

    @Override
    public Optional<AssetNodeDocument> removeOwner(String nodeId, String projectUid) {
        Update update = new Update()
                .pull("owningProjectUids", projectUid)
                .set("updatedAt", Instant.now());
        return modify(nodeId, update);
    }

    @Override
    public Optional<AssetNodeDocument> refreshMetadata(String nodeId, String name, Long sizeBytes, String fileType) {
        Update update = new Update().set("updatedAt", Instant.now());
        if (name != null) {
            update.set("name", name);
        }
        if (sizeBytes != null) {
            update.set("sizeBytes", sizeBytes);
        }
        if (fileType != null) {
            update.set("fileType", fileType);
        }
        return modify(nodeId, update);
    }

    @Override
    public void updateStatus(String nodeId, AssetDownloadStatus status, String localPath) {
        Update update = new Update()
                .set("downloadStatus", status)
                .set("updatedAt", Instant.now());
        if (localPath != null) {
            update.set("localPath", localPath);
        } else {
            update.unset("localPath");
        }
        mongoTemplate.updateFirst(byId(nodeId), update, AssetNodeDocument.class);
    }

    @Override
    public void updateDownloadUrl(String nodeId, String downloadUrl, String fileType) {
        Update update = new Update()
                .set("downloadUrl", downloadUrl)
                .set("updatedAt", Instant.now());
        if (fileType != null) {
            update.set("fileType", fileType);
        }
        mongoTemplate.updateFirst(byId(nodeId), update, AssetNodeDocument.class);
    }

    @Override
    public boolean deleteIfOrphaned(String nodeId) {
        Query query = new Query(new Criteria().andOperator(
                Criteria.where("_id").is(nodeId),
                new Criteria().orOperator(
                        Criteria.where("owningProjectUids").size(0),
                        Criteria.where("owningProjectUids").exists(false))));
        return mongoTemplate.remove(query, AssetNodeDocument.class).getDeletedCount() > 0;
    }

    private Optional<AssetNodeDocument> modify(String nodeId, Update update) {
        AssetNodeDocument result = mongoTemplate.findAndModify(byId(nodeId), update,
                FindAndModifyOptions.options().returnNew(true), AssetNodeDocument.class);
        return Optional.ofNullable(result);
    }

    private static Query byId(String nodeId) {
        return new Query(Criteria.where("_id").is(nodeId));
    }
}
