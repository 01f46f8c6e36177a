package com.example.acl.web;

import com.example.acl.auth.context.IdentityContextHolder;
import com.example.acl.auth.model.TokenPair;
import com.example.acl.auth.service.TokenOperations;
import com.example.acl.authz.enforcement.AclRequestGateway;
import com.example.acl.engine.MutationResult;
import com.example.acl.request.model.AlterRequest;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryRequest;
import com.example.acl.request.parser.NQuadParser;
import com.example.acl.request.parser.SchemaParser;
import com.example.acl.web.dto.AlterBody;
import com.example.acl.web.dto.DataResponse;
import com.example.acl.web.dto.LoginRequest;
import com.example.acl.web.dto.MutateRequest;
import com.example.acl.web.dto.RefreshRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AclController {

    private final TokenOperations tokenService;
    private final AclRequestGateway gateway;

    @PostMapping("/login")
    public Mono<TokenPair> login(@Valid @RequestBody LoginRequest request) {
        return tokenService.authenticate(request.userId(), request.password());
    }

    @PostMapping("/refresh")
    public Mono<TokenPair> refresh(@Valid @RequestBody RefreshRequest request) {
        return tokenService.refresh(request.refreshToken());
    }

    @PostMapping("/logout")
    public Mono<ResponseEntity<Void>> logout(@Valid @RequestBody RefreshRequest request) {
        return tokenService.revoke(request.refreshToken())
                .thenReturn(ResponseEntity.noContent().build());
    }

    @PostMapping("/query")
    public Mono<DataResponse<ObjectNode>> query(@RequestBody QueryRequest request) {
        return IdentityContextHolder.getIdentity()
                .flatMap(identity -> gateway.query(identity, request))
                .map(DataResponse::of);
    }

    @PostMapping("/mutate")
    public Mono<DataResponse<MutationResult>> mutate(@RequestBody MutateRequest request) {
        return Mono.fromCallable(() -> new MutationRequest(
                        NQuadParser.parse(request.set()), NQuadParser.parse(request.delete())))
                .flatMap(mutation -> IdentityContextHolder.getIdentity()
                        .flatMap(identity -> gateway.mutate(identity, mutation)))
                .map(DataResponse::of);
    }

    @PostMapping("/alter")
    public Mono<DataResponse<Map<String, String>>> alter(@RequestBody AlterBody request) {
        return Mono.fromCallable(() -> new AlterRequest(
                        SchemaParser.parse(request.schema()), request.dropAttr(), request.dropAll()))
                .flatMap(alter -> IdentityContextHolder.getIdentity()
                        .flatMap(identity -> gateway.alter(identity, alter)))
                .thenReturn(DataResponse.of(Map.of("code", "Success", "message", "Done")));
    }

    @GetMapping("/schema")
    public Mono<DataResponse<Map<String, List<PredicateSchema>>>> schema() {
        return IdentityContextHolder.getIdentity()
                .flatMapMany(gateway::schema)
                .collectList()
                .map(schema -> DataResponse.of(Map.of("schema", schema)));
    }
}
