package com.example.shiftplanner.config;

import com.example.shiftplanner.employee.*;
import com.example.shiftplanner.shift.*;
import com.example.shiftplanner.skill.Skill;
import com.example.shiftplanner.skill.SkillRepository;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
import com.example.shiftplanner.station.StationRepository;
import com.example.shiftplanner.station.StationSkillRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConditionalOnProperty(name = "planning.demo-data.enabled", havingValue = "true")
public class PlanningDataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(PlanningDataInitializer.class);

    // Seeds a small plant when the employee table is empty
    @Bean
    CommandLineRunner loadPlanningData(SkillRepository skillRepository,
                                       StationRepository stationRepository,
                                       ShiftTemplateRepository templateRepository,
                                       EmployeeRepository employeeRepository,
                                       EmployeeSkillRepository employeeSkillRepository,
                                       WorkingHourRuleRepository ruleRepository,
                                       ShiftDemandRepository demandRepository,
                                       Clock clock) {
        return args -> {
            if (employeeRepository.count() > 0) {
                return;
            }
            Skill welding = skillRepository.save(new Skill("welding", "Welding", "MIG and TIG welding"));
            Skill assembly = skillRepository.save(new Skill("assembly", "Assembly", "Line assembly"));
            Skill inspection = skillRepository.save(new Skill("inspection", "Inspection", "Quality inspection"));

            Station weld = new Station("st-weld-1", "Welding Cell 1", "line-1", Priority.HIGH);
            weld.addRequirement(new StationSkillRequirement(welding, 3, true));
            Station assemble = new Station("st-asm-1", "Assembly 1", "line-1", Priority.MEDIUM);
            assemble.addRequirement(new StationSkillRequirement(assembly, 2, true));
            assemble.addRequirement(new StationSkillRequirement(inspection, 1, false));
            Station qa = new Station("st-qa-1", "Final Inspection", "line-1", Priority.CRITICAL);
            qa.addRequirement(new StationSkillRequirement(inspection, 3, true));
            List<Station> stations = stationRepository.saveAll(List.of(weld, assemble, qa));

            ShiftTemplate early = new ShiftTemplate("early", "Early", LocalTime.of(6, 0), LocalTime.of(14, 0), ShiftType.DAY);
            ShiftTemplate late = new ShiftTemplate("late", "Late", LocalTime.of(14, 0), LocalTime.of(22, 0), ShiftType.SWING);
            ShiftTemplate night = new ShiftTemplate("night", "Night", LocalTime.of(22, 0), LocalTime.of(6, 0), ShiftType.NIGHT);
            List<ShiftTemplate> templates = templateRepository.saveAll(List.of(early, late, night));

            ruleRepository.save(new WorkingHourRule("Full time", ContractType.FULL_TIME));
            WorkingHourRule partTime = new WorkingHourRule("Part time", ContractType.PART_TIME);
            partTime.setMaxHoursPerWeek(24);
            partTime.setMaxHoursPerDay(8);
            partTime.setWeekendWorkAllowed(false);
            ruleRepository.save(partTime);

            Skill[] skills = {welding, assembly, inspection};
            List<Employee> employees = new ArrayList<>();
            List<EmployeeSkill> employeeSkills = new ArrayList<>();
            for (int i = 1; i <= 18; i++) {
                ContractType contract = i % 6 == 0 ? ContractType.PART_TIME : ContractType.FULL_TIME;
                Employee employee = new Employee("emp-%03d".formatted(i), "Employee %02d".formatted(i), contract);
                employee.setTeam(i % 2 == 0 ? "A" : "B");
                if (i % 5 == 0) {
                    employee.setPreferredShiftType(ShiftType.NIGHT);
                }
                employees.add(employee);
                employeeSkills.add(new EmployeeSkill(employee, skills[i % 3], 2 + i % 4, null));
                if (i % 4 == 0) {
                    employeeSkills.add(new EmployeeSkill(employee, skills[(i + 1) % 3], 3, null));
                }
            }
            employeeRepository.saveAll(employees);
            employeeSkillRepository.saveAll(employeeSkills);

            LocalDate today = LocalDate.now(clock);
            List<ShiftDemand> demands = new ArrayList<>();
            for (int day = 0; day < 7; day++) {
                LocalDate date = today.plusDays(day);
                for (Station station : stations) {
                    for (ShiftTemplate template : templates) {
                        int required = template.getShiftType() == ShiftType.NIGHT ? 1 : 2;
                        demands.add(new ShiftDemand("dm-%s-%s-%s".formatted(date, station.getId(), template.getId()),
                                date, station, template, required));
                    }
                }
            }
            demandRepository.saveAll(demands);
            logger.info("Seeded demo planning data: {} employees, {} stations, {} demands",
                    employees.size(), stations.size(), demands.size());
        };
    }
}
