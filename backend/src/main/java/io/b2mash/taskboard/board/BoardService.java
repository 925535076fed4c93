package io.b2mash.taskboard.board;

import io.b2mash.taskboard.exception.FieldValidationException;
import io.b2mash.taskboard.exception.ResourceNotFoundException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BoardService {

  private static final Logger log = LoggerFactory.getLogger(BoardService.class);

  private final BoardRepository boardRepository;

  public BoardService(BoardRepository boardRepository) {
    this.boardRepository = boardRepository;
  }

  @Transactional(readOnly = true)
  public List<Board> listBoards() {
    return boardRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public Board getBoard(Long id) {
    return boardRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Board", id));
  }

  @Transactional
  public Board createBoard(String name) {
    if (boardRepository.existsByName(name)) {
      throw duplicateName(name);
    }
    var board = boardRepository.save(new Board(name));
    log.info("Created board {}", board.getId());
    return board;
  }

  @Transactional
  public Board renameBoard(Long id, String name) {
    var board = getBoard(id);
    if (boardRepository.existsByNameAndIdNot(name, id)) {
      throw duplicateName(name);
    }
    board.rename(name);
    board = boardRepository.save(board);
    log.info("Renamed board {}", id);
    return board;
  }

  @Transactional
  public void deleteBoard(Long id) {
    boardRepository.delete(getBoard(id));
    log.info("Deleted board {}", id);
  }

  private static FieldValidationException duplicateName(String name) {
    return new FieldValidationException("name", "A board named '" + name + "' already exists");
  }
}
