package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.api.dto.CheckpointRequest;
import com.z254.swarm.hive.domain.model.Checkpoint;
import com.z254.swarm.hive.persistence.CheckpointService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller for whole-system checkpoints.
 */
@RestController
@RequestMapping("/api/v1/checkpoints")
@Tag(name = "Checkpoints", description = "Save and restore the whole system")
@Slf4j
public class CheckpointController {

    private final CheckpointService checkpointService;

    public CheckpointController(CheckpointService checkpointService) {
        this.checkpointService = checkpointService;
    }

    @PostMapping
    @Operation(summary = "Save checkpoint")
    @ApiResponse(responseCode = "201", description = "Checkpoint written")
    public Mono<ResponseEntity<Checkpoint.Info>> save(@Valid @RequestBody(required = false) CheckpointRequest request) {
        String name = request != null ? request.getName() : null;
        return checkpointService.save(name)
                .map(info -> ResponseEntity.status(HttpStatus.CREATED).body(info));
    }

    @GetMapping
    @Operation(summary = "List checkpoints", description = "Newest first")
    public Flux<Checkpoint.Info> list() {
        return checkpointService.list();
    }

    @GetMapping("/latest")
    @Operation(summary = "Latest checkpoint")
    public Mono<ResponseEntity<Checkpoint.Info>> latest() {
        return checkpointService.latest()
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/restore")
    @Operation(summary = "Restore checkpoint", description = "Create missing agents and restore every snapshot")
    public Mono<Checkpoint.Info> restore(@PathVariable String name) {
        log.info("Restoring checkpoint {}", name);
        return checkpointService.load(name);
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Delete checkpoint")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String name) {
        return checkpointService.delete(name)
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
