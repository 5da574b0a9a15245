package dao.solana.svol.repository;

import dao.solana.svol.model.Schedule;

import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {

    void save(Schedule schedule);

    List<Schedule> findAll();

    Optional<Schedule> findById(String id);
}
