package com.example.acl.authz.store.repository;

import com.example.acl.authz.store.document.AclUserDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for ACL users.
 */
@Repository
public interface AclUserRepository extends ReactiveMongoRepository<AclUserDoc, String> {
}
