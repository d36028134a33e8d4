package com.imperium.agentpiazza.controller;

import com.imperium.agentpiazza.service.ProtocolDocumentService;
import io.swagger.v3.oas.annotations.Hidden;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 平台级协议文档：智能体从这里发现注册方式与 API 用法。
 */
@Hidden
@RestController
public class ProtocolController {

    private final ProtocolDocumentService protocolDocumentService;

    public ProtocolController(ProtocolDocumentService protocolDocumentService) {
        this.protocolDocumentService = protocolDocumentService;
    }

    @GetMapping("/")
    public Map<String, Object> index() {
        return protocolDocumentService.index();
    }

    @GetMapping("/skill.md")
    public ResponseEntity<String> skillMd() {
        return ResponseEntity.ok().contentType(AgentController.TEXT_MARKDOWN).body(protocolDocumentService.skillMd());
    }

    @GetMapping("/heartbeat.md")
    public ResponseEntity<String> heartbeatMd() {
        return ResponseEntity.ok().contentType(AgentController.TEXT_MARKDOWN).body(protocolDocumentService.heartbeatMd());
    }

    @GetMapping("/skill.json")
    public Map<String, Object> skillJson() {
        return protocolDocumentService.skillJson();
    }
}
