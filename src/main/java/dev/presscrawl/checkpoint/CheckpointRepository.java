package dev.presscrawl.checkpoint;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link CheckpointEntity} rows. */
public interface CheckpointRepository extends JpaRepository<CheckpointEntity, String> {

  List<CheckpointEntity> findAllByOrderBySourceIdAsc();
}
