package com.delta.listener.signal.api;

import com.delta.listener.signal.keywords.KeywordService;
import com.delta.listener.signal.model.KeywordCategory;
import com.delta.listener.signal.model.KeywordDefinition;
import com.delta.listener.signal.model.KeywordStats;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/listener/keywords")
public class KeywordController {
    private final KeywordService keywordService;

    public KeywordController(KeywordService keywordService) {
        this.keywordService = keywordService;
    }

    @GetMapping
    public List<KeywordDefinition> listKeywords(
        @RequestParam(name = "category", required = false) String category,
        @RequestParam(name = "activeOnly", required = false, defaultValue = "false") boolean activeOnly
    ) {
        if (activeOnly || (category != null && !category.isBlank())) {
            return keywordService.listActive(KeywordCategory.fromCode(category));
        }
        return keywordService.listAll();
    }

    @GetMapping("/stats")
    public KeywordStats stats() {
        return keywordService.stats();
    }

    @GetMapping("/{id}")
    public KeywordDefinition getKeyword(@PathVariable("id") long id) {
        return keywordService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public KeywordDefinition addKeyword(@RequestBody KeywordApiRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("keyword is required");
        }
        return keywordService.add(
            request.keyword(),
            KeywordCategory.fromCode(request.category()),
            request.weight(),
            request.productTags()
        );
    }

    @PostMapping("/bulk")
    public KeywordService.BulkAddResult bulkAdd(@RequestBody BulkKeywordApiRequest request) {
        List<KeywordDefinition> keywords = request == null || request.keywords() == null
            ? List.of()
            : request.keywords().stream()
                .map(k -> KeywordDefinition.of(
                    k.keyword(),
                    KeywordCategory.fromCode(k.category()),
                    k.weight() == null ? 0 : k.weight(),
                    k.productTags()
                ))
                .toList();
        return keywordService.bulkAdd(keywords);
    }

    @PutMapping("/{id}")
    public KeywordDefinition updateKeyword(@PathVariable("id") long id, @RequestBody KeywordApiRequest request) {
        if (request == null) {
            return keywordService.get(id);
        }
        return keywordService.update(
            id,
            request.keyword(),
            KeywordCategory.fromCode(request.category()),
            request.weight(),
            request.productTags(),
            request.active()
        );
    }

    @PostMapping("/{id}/toggle")
    public KeywordDefinition toggleKeyword(@PathVariable("id") long id) {
        return keywordService.toggle(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteKeyword(@PathVariable("id") long id) {
        keywordService.delete(id);
    }

    @PutMapping("/categories/{category}/weight")
    public Map<String, Object> updateCategoryWeight(
        @PathVariable("category") String category,
        @RequestBody CategoryWeightApiRequest request
    ) {
        if (request == null || request.weight() == null) {
            throw new IllegalArgumentException("weight is required");
        }
        KeywordCategory parsed = KeywordCategory.fromCode(category);
        if (parsed == null) {
            throw new IllegalArgumentException("category is required");
        }
        int updated = keywordService.updateCategoryWeight(parsed, request.weight());
        return Map.of("category", parsed.code(), "weight", request.weight(), "updated", updated);
    }
}
