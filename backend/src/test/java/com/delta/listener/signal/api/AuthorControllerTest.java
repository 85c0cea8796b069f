package com.delta.listener.signal.api;

import com.delta.listener.signal.model.AuthorCompanyInfo;
import com.delta.listener.signal.model.AuthorProfile;
import com.delta.listener.signal.model.AuthorProfilePage;
import com.delta.listener.signal.model.CompanySource;
import com.delta.listener.signal.model.HnUser;
import com.delta.listener.signal.model.SocialProfiles;
import com.delta.listener.signal.service.ActiveScanRunException;
import com.delta.listener.signal.service.AuthorNotFoundException;
import com.delta.listener.signal.service.AuthorProfileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AuthorControllerTest {

    @Autowired
    private AuthorController authorController;

    @Autowired
    private AuthorProfileService authorProfileService;

    @Test
    void excludedAuthorLeavesListing() {
        String username = "seller_" + suffix();
        authorProfileService.recordScan(
            new HnUser(username, 1_500_000_000L, 4_000, "I run https://resaleco.com", List.of()),
            new AuthorCompanyInfo(username, "resaleco.com", "Resaleco", 0.9, CompanySource.ABOUT_URL, null, SocialProfiles.none()),
            null,
            null,
            false
        );
        assertThat(listedUsernames()).contains(username);

        AuthorProfile excluded = authorController.exclude(username, new AuthorExcludeApiRequest("ticket reseller"));

        assertTrue(excluded.excluded());
        assertEquals("ticket reseller", excluded.exclusionReason());
        assertThat(listedUsernames()).doesNotContain(username);
        assertThat(authorController.listExcluded()).extracting(AuthorProfile::username).contains(username);
        assertEquals(username, authorController.getAuthor(username).username());
    }

    @Test
    void excludeWithoutBodyHasNoReason() {
        String username = "quiet_" + suffix();
        authorProfileService.recordScan(
            new HnUser(username, 1_500_000_000L, 100, null, List.of()),
            new AuthorCompanyInfo(username, null, null, 0.0, null, null, null),
            null,
            null,
            false
        );

        assertNull(authorController.exclude(username, null).exclusionReason());
    }

    @Test
    void errorsMapToStatusCodes() {
        ListenerExceptionHandler handler = new ListenerExceptionHandler();

        ResponseEntity<Map<String, String>> conflict = handler.handleActiveRun(new ActiveScanRunException("run id=4 active"));
        ResponseEntity<Map<String, String>> missing = handler.handleNotFound(new AuthorNotFoundException("ghost"));
        ResponseEntity<Map<String, String>> bad = handler.handleBadRequest(new IllegalArgumentException());

        assertEquals(HttpStatus.CONFLICT, conflict.getStatusCode());
        assertEquals("active_scan_run", conflict.getBody().get("error"));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("Author ghost not found", missing.getBody().get("message"));
        assertEquals(HttpStatus.BAD_REQUEST, bad.getStatusCode());
        assertEquals("bad_request", bad.getBody().get("message"));
    }

    private List<String> listedUsernames() {
        AuthorProfilePage page = authorController.listAuthors(null, null, 500, 0);
        return page.authors().stream().map(AuthorProfile::username).toList();
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 6);
    }
}
