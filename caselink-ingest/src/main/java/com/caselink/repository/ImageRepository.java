package com.caselink.repository;

import com.caselink.model.Image;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class ImageRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Image> IMAGE_MAPPER = (rs, rowNum) -> new Image(
        rs.getLong("id"),
        rs.getLong("person_id"),
        rs.getString("storage_url"),
        rs.getString("storage_key"),
        rs.getString("image_type"),
        rs.getBoolean("is_primary"),
        rs.getString("source_attribution")
    );

    public ImageRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Image> findByPersonId(Long personId) {
        return jdbc.query(
            "SELECT * FROM images WHERE person_id = ? ORDER BY is_primary DESC, id",
            IMAGE_MAPPER, personId
        );
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM images", Integer.class);
        return count != null ? count : 0;
    }

    public void insert(Image image) {
        jdbc.update("""
            INSERT INTO images (person_id, storage_url, storage_key, image_type, is_primary, source_attribution)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            image.personId(), image.storageUrl(), image.storageKey(), image.imageType(),
            image.primary(), image.sourceAttribution()
        );
    }
}
