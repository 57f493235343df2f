package quest.gekko.pulse.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Catalog entry of the interest taxonomy that articles are matched against.
 */
@Entity
@Table(name = "interest")
@Getter @Setter
public class Interest {
    @Id
    String id;

    String name;
    int sortOrder;
}
