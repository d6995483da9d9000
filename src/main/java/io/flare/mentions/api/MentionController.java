package io.flare.mentions.api;

import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.service.store.MentionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/mentions")
public class MentionController {

    private final MentionStore mentionStore;

    public MentionController(MentionStore mentionStore) {
        this.mentionStore = mentionStore;
    }

    @GetMapping
    public ResponseEntity<List<Mention>> getMentions(@RequestParam(required = false) String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(mentionStore.findByKeyword(keyword.trim()));
    }

    @GetMapping("/leads")
    public List<Mention> getLeads() {
        return mentionStore.findLeads();
    }
}
