package app.lingvo.core.study.controller;

import app.lingvo.core.config.CorsProps;
import app.lingvo.core.config.SecurityConfig;
import app.lingvo.core.security.CurrentUserProvider;
import app.lingvo.core.study.controller.dto.ProgressSummaryResponse;
import app.lingvo.core.study.exception.NotFoundException;
import app.lingvo.core.study.service.ProgressSummaryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProgressController.class)
@Import(SecurityConfig.class)
@EnableConfigurationProperties(CorsProps.class)
@ActiveProfiles("test")
class ProgressControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ProgressSummaryService summaryService;

    @MockitoBean
    CurrentUserProvider currentUserProvider;

    @MockitoBean
    JwtDecoder jwtDecoder;

    final UUID userId = UUID.randomUUID();
    final UUID languageId = UUID.randomUUID();

    @Test
    void summary_returnsCountsForCaller() throws Exception {
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(summaryService.summary(userId, languageId)).thenReturn(new ProgressSummaryResponse(
                languageId, 200, 50, 30, 4, 7, 25.0, Instant.parse("2024-03-10T08:30:00Z")));

        mockMvc.perform(get("/study/languages/{languageId}/progress", languageId).with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(200))
                .andExpect(jsonPath("$.studied").value(50))
                .andExpect(jsonPath("$.dueToday").value(7))
                .andExpect(jsonPath("$.percentage").value(25.0));
    }

    @Test
    void summary_unknownLanguageMapsToNotFound() throws Exception {
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(summaryService.summary(userId, languageId)).thenThrow(NotFoundException.language(languageId));

        mockMvc.perform(get("/study/languages/{languageId}/progress", languageId).with(jwt()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                .andExpect(jsonPath("$.detail").value("Language not found: " + languageId));
    }

    @Test
    void summary_queryTimeoutMapsToServiceUnavailable() throws Exception {
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(summaryService.summary(userId, languageId)).thenThrow(new QueryTimeoutException("statement timeout"));

        mockMvc.perform(get("/study/languages/{languageId}/progress", languageId).with(jwt()))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("STORE_UNAVAILABLE"));
    }

    @Test
    void anonymousRequestIsRejected() throws Exception {
        mockMvc.perform(get("/study/languages/{languageId}/progress", languageId))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(summaryService);
    }
}
