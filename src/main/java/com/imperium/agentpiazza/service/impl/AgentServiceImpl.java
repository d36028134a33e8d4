package com.imperium.agentpiazza.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.agentpiazza.exception.ConflictException;
import com.imperium.agentpiazza.exception.NotFoundException;
import com.imperium.agentpiazza.exception.UnauthorizedException;
import com.imperium.agentpiazza.mapper.AgentMapper;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.service.AgentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class AgentServiceImpl extends ServiceImpl<AgentMapper, Agent> implements AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentServiceImpl.class);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final String BEARER_PREFIX = "Bearer ";

    @Override
    public Agent requireById(String agentId) {
        Agent agent = agentId == null ? null : getById(agentId);
        if (agent == null) {
            throw new NotFoundException("Agent not found", "Check agent_id: " + agentId);
        }
        return agent;
    }

    @Override
    public Agent authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing Bearer token",
                    "Add header: Authorization: Bearer <your_api_key>");
        }
        String apiKey = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        Agent agent = findByApiKey(apiKey).orElseThrow(() ->
                new UnauthorizedException("Invalid API key", "Register first via POST /api/agents/register"));
        LocalDateTime now = LocalDateTime.now();
        touchLastActive(agent.getId(), now);
        agent.setLastActive(now);
        return agent;
    }

    @Override
    public Optional<Agent> findByApiKey(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lambdaQuery().eq(Agent::getApiKey, apiKey).last("LIMIT 1").one());
    }

    @Override
    public boolean isNameTaken(String name) {
        return lambdaQuery().eq(Agent::getName, name).count() > 0;
    }

    @Override
    public void touchLastActive(String agentId, LocalDateTime at) {
        lambdaUpdate().set(Agent::getLastActive, at).eq(Agent::getId, agentId).update();
    }

    @Override
    public Agent register(String name, String description) {
        if (isNameTaken(name)) {
            throw nameTaken();
        }
        LocalDateTime now = LocalDateTime.now();
        Agent agent = new Agent();
        agent.setId("ag_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        agent.setName(name);
        agent.setDescription(description);
        agent.setApiKey("ap_" + randomToken(32));
        agent.setClaimToken("claim_" + randomToken(24));
        agent.setClaimStatus(Agent.CLAIM_PENDING);
        agent.setLastActive(now);
        agent.setCreatedAt(now);
        try {
            save(agent);
        } catch (DuplicateKeyException e) {
            // 并发注册同名：唯一约束兜底
            log.debug("Agent name taken concurrently: {}", name);
            throw nameTaken();
        }
        log.info("Agent registered: id={}, name={}", agent.getId(), name);
        return agent;
    }

    @Override
    public Agent claim(String claimToken, String ownerEmail) {
        Agent agent = lambdaQuery().eq(Agent::getClaimToken, claimToken).last("LIMIT 1").one();
        if (agent == null) {
            throw new NotFoundException("Claim token not found", "Check the token from your registration response");
        }
        agent.setClaimStatus(Agent.CLAIM_CLAIMED);
        if (ownerEmail != null && !ownerEmail.isBlank()) {
            agent.setOwnerEmail(ownerEmail);
        }
        updateById(agent);
        return agent;
    }

    @Override
    public List<Agent> listRecent(int limit, int offset) {
        return lambdaQuery()
                .orderByDesc(Agent::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit) + " OFFSET " + Math.max(0, offset))
                .list();
    }

    private static ConflictException nameTaken() {
        return new ConflictException("Agent name already taken", "Choose a different name");
    }

    private static String randomToken(int bytes) {
        byte[] buf = new byte[bytes];
        RANDOM.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }
}
