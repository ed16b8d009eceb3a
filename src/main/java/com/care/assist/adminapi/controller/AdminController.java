package com.care.assist.adminapi.controller;

import com.care.assist.config.SessionPolicy;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.repository.SessionArchiveRepository;
import com.care.assist.service.ObservabilitySink;
import com.care.assist.service.SessionRegistryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminController {

    @Autowired
    private SessionPolicy sessionPolicy;

    @Autowired
    private ObservabilitySink observabilitySink;

    @Autowired
    private SessionRegistryService registryService;

    @Autowired
    private SessionArchiveRepository archiveRepository;

    @GetMapping("/config")
    public Map<String, Object> getConfig() {
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", sessionPolicy.snapshot());
        out.put("persistenceEnabled", archiveRepository.isPersistenceEnabled());
        out.put("archiveDir", archiveRepository.getDataDir());
        return out;
    }

    @GetMapping("/observability")
    public Map<String, Object> observability(
            @RequestParam(required = false) Long sinceMs,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String kind) {
        List<ObservabilitySink.Entry> entries = observabilitySink.query(sinceMs, limit, kind);
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", entries);
        out.put("count", entries.size());
        out.put("stats", observabilitySink.stats());
        return out;
    }

    @GetMapping("/sessions")
    public Map<String, Object> listActive() {
        List<SessionSnapshot> list = registryService.listActive();
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", list);
        out.put("count", list.size());
        return out;
    }

    @PostMapping("/sessions/{id}/reattach")
    public Map<String, Object> reattach(@PathVariable String id) {
        SessionSnapshot snapshot = registryService.reattach(id);
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", snapshot);
        return out;
    }
}
