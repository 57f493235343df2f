package quest.gekko.pulse.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An ingested article as written by the ingestion pipeline. The ranking engine only reads it.
 */
@Entity
@Table(name = "article", indexes = {
        @Index(name = "idx_article_published", columnList = "publishedAt"),
        @Index(name = "idx_article_created", columnList = "createdAt")
})
@Getter @Setter
public class Article {
    @Id
    String id;

    @Column(length = 2048)
    String url;

    String sourceId;

    @Column(length = 1024)
    String title;

    @Column(columnDefinition = "text")
    String summary;

    @Column(length = 2048)
    String imageUrl;

    Instant publishedAt;
    Instant createdAt;

    // mood signals from the text-feature extractor, 0..1 when present
    Double arousal;
    Double sentiment;
    Double depth;
    Double conflict;
    Double practicality;
    Double optimism;
    Double novelty;
    Double humanInterest;
    Double hype;
    Double explainer;
    Double analysis;
    Double wholesome;
    Integer readMinutes;

    String genre;
    String eventStage;
    String format;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "article_tag", joinColumns = @JoinColumn(name = "article_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag")
    List<String> tags = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "article_interest", joinColumns = @JoinColumn(name = "article_id"))
    @OrderColumn(name = "position")
    @Column(name = "interest_id")
    List<String> interestMatches = new ArrayList<>();

    @Convert(converter = FloatArrayConverter.class)
    @Column(columnDefinition = "text")
    float[] embedding;
}
