package io.b2mash.taskboard.board;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BoardRepository extends JpaRepository<Board, Long> {

  List<Board> findAllByOrderByNameAsc();

  boolean existsByName(String name);

  boolean existsByNameAndIdNot(String name, Long id);
}
