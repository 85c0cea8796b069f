package com.delta.listener.signal.api;

import com.delta.listener.signal.model.AuthorProfile;
import com.delta.listener.signal.model.AuthorProfilePage;
import com.delta.listener.signal.model.AuthorProfileStats;
import com.delta.listener.signal.service.AuthorProfileService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/listener/authors")
public class AuthorController {
    private final AuthorProfileService authorProfileService;

    public AuthorController(AuthorProfileService authorProfileService) {
        this.authorProfileService = authorProfileService;
    }

    @GetMapping
    public AuthorProfilePage listAuthors(
        @RequestParam(name = "minKarma", required = false) Integer minKarma,
        @RequestParam(name = "minConfidence", required = false) Double minConfidence,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit,
        @RequestParam(name = "offset", required = false, defaultValue = "0") int offset
    ) {
        return authorProfileService.listWithCompanies(minKarma, minConfidence, limit, offset);
    }

    @GetMapping("/stats")
    public AuthorProfileStats stats() {
        return authorProfileService.stats();
    }

    @GetMapping("/excluded")
    public List<AuthorProfile> listExcluded() {
        return authorProfileService.listExcluded();
    }

    @GetMapping("/{username}")
    public AuthorProfile getAuthor(@PathVariable("username") String username) {
        return authorProfileService.getProfile(username);
    }

    @PostMapping("/{username}/exclude")
    public AuthorProfile exclude(
        @PathVariable("username") String username,
        @RequestBody(required = false) AuthorExcludeApiRequest request
    ) {
        return authorProfileService.exclude(username, request == null ? null : request.reason());
    }
}
