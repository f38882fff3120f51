package com.killfeed.engine.domain.repository;

import com.killfeed.engine.domain.model.EventQuery;
import com.killfeed.engine.domain.model.StoredEventRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.List;

public class StoredEventSearchRepositoryImpl implements StoredEventSearchRepository {

    private static final char LIKE_ESCAPE = '\\';

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<StoredEventRecord> search(EventQuery query) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<StoredEventRecord> cq = cb.createQuery(StoredEventRecord.class);
        Root<StoredEventRecord> root = cq.from(StoredEventRecord.class);

        cq.select(root)
                .where(predicates(cb, root, query))
                .orderBy(cb.desc(root.get("timestampEpochMs")), cb.desc(root.get("createdAtEpochMs")));

        return entityManager.createQuery(cq)
                .setFirstResult(Math.max(0, query.getOffset()))
                .setMaxResults(Math.max(1, query.getLimit()))
                .getResultList();
    }

    @Override
    public long countMatching(EventQuery query) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> cq = cb.createQuery(Long.class);
        Root<StoredEventRecord> root = cq.from(StoredEventRecord.class);
        cq.select(cb.count(root)).where(predicates(cb, root, query));
        return entityManager.createQuery(cq).getSingleResult();
    }

    private Predicate[] predicates(CriteriaBuilder cb, Root<StoredEventRecord> root, EventQuery query) {
        List<Predicate> predicates = new ArrayList<>();
        if (query.isPlayerOnly()) {
            predicates.add(cb.isTrue(root.get("playerInvolved")));
        }
        if (query.getSource() != null) {
            predicates.add(cb.equal(root.get("source"), query.getSource()));
        }
        if (query.getFromEpochMs() != null) {
            predicates.add(cb.greaterThanOrEqualTo(root.get("timestampEpochMs"), query.getFromEpochMs()));
        }
        if (query.getToEpochMs() != null) {
            predicates.add(cb.lessThanOrEqualTo(root.get("timestampEpochMs"), query.getToEpochMs()));
        }

        List<String> terms = query.searchTerms();
        if (!terms.isEmpty()) {
            Predicate[] anyTerm = terms.stream()
                    .map(term -> cb.like(root.get("searchText"), "%" + escape(term) + "%", LIKE_ESCAPE))
                    .toArray(Predicate[]::new);
            predicates.add(cb.or(anyTerm));
        }
        return predicates.toArray(new Predicate[0]);
    }

    private static String escape(String term) {
        return term.replace("\\", "\\\\");
    }
}
