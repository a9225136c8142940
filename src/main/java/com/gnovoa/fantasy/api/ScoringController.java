package com.gnovoa.fantasy.api;

import com.gnovoa.fantasy.api.dto.FormationResponse;
import com.gnovoa.fantasy.api.dto.GoalsResponse;
import com.gnovoa.fantasy.api.dto.ScoreRequest;
import com.gnovoa.fantasy.api.dto.ScoreResponse;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api")
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private final ScoringFacade facade;

    public ScoringController(ScoringFacade facade) {
        this.facade = facade;
    }

    @GetMapping("/formations")
    public List<FormationResponse> formations() {
        return facade.formations();
    }

    @GetMapping("/formations/{id}")
    public FormationResponse formation(@PathVariable String id) {
        return facade.formation(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unsupported formation " + id));
    }

    @PostMapping("/scores")
    public ScoreResponse score(@RequestBody ScoreRequest request) {
        try {
            return facade.score(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected score request: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @PostMapping(value = "/scores/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ScoreResponse scoreUpload(@RequestPart("team") ScoreRequest team,
                                     @RequestPart("fixture") MultipartFile fixture) {
        String source = fixture.getOriginalFilename() == null ? "fixture" : fixture.getOriginalFilename();
        try (InputStream in = fixture.getInputStream()) {
            return facade.score(team, in, source);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Rejected uploaded score request: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unreadable fixture upload", e);
        }
    }

    @GetMapping("/goals")
    public GoalsResponse goals(@RequestParam double points) {
        try {
            return facade.goals(points);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
