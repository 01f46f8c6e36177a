package com.example.acl;

import com.example.acl.auth.service.InMemoryTokenService;
import com.example.acl.auth.service.TokenOperations;
import com.example.acl.authz.store.AclStoreOperations;
import com.example.acl.authz.store.InMemoryAclStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AclApplicationTests {

    @Autowired
    private TokenOperations tokenOperations;

    @Autowired
    private AclStoreOperations store;

    @Test
    void contextLoads() {
        assertThat(tokenOperations).isInstanceOf(InMemoryTokenService.class);
        assertThat(store).isInstanceOf(InMemoryAclStore.class);
    }
}
