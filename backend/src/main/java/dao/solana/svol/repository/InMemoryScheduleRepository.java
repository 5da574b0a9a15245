package dao.solana.svol.repository;

import dao.solana.svol.model.Schedule;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryScheduleRepository implements ScheduleRepository {

    // key: schedule id
    private final Map<String, Schedule> schedulesById = new ConcurrentHashMap<>();

    @Override
    public void save(Schedule schedule) {
        schedulesById.put(schedule.getId(), schedule);
    }

    @Override
    public List<Schedule> findAll() {
        List<Schedule> all = new ArrayList<>(schedulesById.values());
        all.sort(Comparator.comparing(Schedule::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return all;
    }

    @Override
    public Optional<Schedule> findById(String id) {
        return Optional.ofNullable(schedulesById.get(id));
    }
}
