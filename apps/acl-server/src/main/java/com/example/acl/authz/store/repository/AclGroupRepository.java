package com.example.acl.authz.store.repository;

import com.example.acl.authz.store.document.AclGroupDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for ACL groups and their embedded rules.
 */
@Repository
public interface AclGroupRepository extends ReactiveMongoRepository<AclGroupDoc, String> {

    /**
     * All groups ordered by name, used for full snapshot loads.
     */
    Flux<AclGroupDoc> findAllByOrderByNameAsc();
}
