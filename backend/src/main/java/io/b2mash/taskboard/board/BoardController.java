package io.b2mash.taskboard.board;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BoardController {

  private final BoardService boardService;

  public BoardController(BoardService boardService) {
    this.boardService = boardService;
  }

  @GetMapping("/api/boards")
  public ResponseEntity<List<BoardResponse>> listBoards() {
    return ResponseEntity.ok(boardService.listBoards().stream().map(BoardResponse::from).toList());
  }

  @GetMapping("/api/boards/{id}")
  public ResponseEntity<BoardResponse> getBoard(@PathVariable Long id) {
    return ResponseEntity.ok(BoardResponse.from(boardService.getBoard(id)));
  }

  @PostMapping("/api/boards")
  public ResponseEntity<BoardResponse> createBoard(@Valid @RequestBody BoardRequest request) {
    var board = boardService.createBoard(request.name());
    return ResponseEntity.created(URI.create("/api/boards/" + board.getId()))
        .body(BoardResponse.from(board));
  }

  @PutMapping("/api/boards/{id}")
  public ResponseEntity<BoardResponse> renameBoard(
      @PathVariable Long id, @Valid @RequestBody BoardRequest request) {
    return ResponseEntity.ok(BoardResponse.from(boardService.renameBoard(id, request.name())));
  }

  @DeleteMapping("/api/boards/{id}")
  public ResponseEntity<Void> deleteBoard(@PathVariable Long id) {
    boardService.deleteBoard(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record BoardRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name) {}

  public record BoardResponse(Long id, String name, Instant createdAt) {

    public static BoardResponse from(Board board) {
      return new BoardResponse(board.getId(), board.getName(), board.getCreatedAt());
    }
  }
}
