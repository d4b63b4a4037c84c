package dev.resumescreener.ai;

import java.util.Collection;
import java.util.Locale;

/**
 * Structured prompt texts. Each one asks for a single JSON value matching the
 * corresponding DTO in {@code dev.resumescreener.ai.dto}.
 */
public final class Prompts {

    private static final String STRICT_PREFIX = """
            IMPORTANT: your previous answer could not be parsed.
            Reply with ONLY the JSON value requested below. No markdown fences, no commentary,
            no trailing text. Use double quotes for every key and string.

            """;

    private Prompts() {
    }

    public static String strict(String prompt) {
        return STRICT_PREFIX + prompt;
    }

    public static String resumeProfile(String resumeText) {
        return """
                You are an expert ATS resume parser.

                Extract ALL skills mentioned ANYWHERE (skills section + bullets + responsibilities + projects).
                Also extract name/email/phone/location/title/years_exp, LinkedIn, certifications and projects if present.

                Return ONLY valid JSON (no markdown).

                Resume:
                %s

                Return JSON:
                {
                  "name": "",
                  "email": "",
                  "phone": "",
                  "location": "",
                  "linkedin_url": "",
                  "title": "",
                  "years_exp": "",
                  "summary_one_line": "",
                  "skills": {
                    "programming_languages": [],
                    "frontend_web": [],
                    "cloud": [],
                    "devops_cicd_iac": [],
                    "containers_kubernetes": [],
                    "databases_data": [],
                    "messaging_streaming": [],
                    "security_identity": [],
                    "testing_quality": [],
                    "observability_monitoring": [],
                    "architecture_patterns": [],
                    "ai_ml_llm_vector": [],
                    "tools_platforms": []
                  },
                  "skills_flat_unique": [],
                  "certifications": [],
                  "projects": []
                }

                Rules:
                - skills_flat_unique lists every skill once, most prominent first
                - years_exp is total professional experience in years
                """.formatted(resumeText);
    }

    public static String workHistory(String resumeText) {
        return """
                Extract the candidate's work history from the resume.

                Resume:
                %s

                Return ONLY JSON:
                {
                  "work_history": [
                    {"company": "", "title": "", "start_date": "YYYY-MM", "end_date": "YYYY-MM or Present",
                     "duration_months": 0, "technologies": []}
                  ]
                }

                Rules:
                - One entry per position, including every job in the resume
                - Use "Present" as end_date for the current job
                - technologies lists tools and skills used in that job
                - Leave duration_months null if you cannot compute it
                """.formatted(resumeText);
    }

    public static String skillExperience(Collection<String> skills, String resumeText) {
        return """
                Extract work experience for these skills from the resume.

                Skills: %s

                Resume:
                %s

                Return ONE JSON object:
                {
                  "skill1": {"jobs_using_skill": [{"company": "X", "start_date": "YYYY-MM", "end_date": "YYYY-MM", "duration_months": N, "evidence": "..."}]},
                  "skill2": {"jobs_using_skill": []}
                }

                Variants (treat as same):
                - AWS EC2 = Amazon EC2 = EC2
                - .NET = dotnet = ASP.NET = .NET 6

                Rules:
                - Return ONE object with ALL skills, keyed by the skill names given above
                - Only include skills USED in work (not just listed)
                - Scan ENTIRE work history
                - Calculate duration_months accurately
                - If skill not used, return empty array: {"jobs_using_skill": []}
                """.formatted(String.join(", ", skills), resumeText);
    }

    public static String jobRequirements(String jdText) {
        return """
                Extract requirements from this Job Description.
                Return ONLY JSON.

                JD:
                %s

                Return:
                {
                  "job_title": "",
                  "core_skills": [
                    {"name": "", "importance": "critical|required|preferred", "min_years": 0, "variants": []}
                  ],
                  "secondary_skills": [
                    {"name": "", "importance": "required", "min_years": 0, "variants": []}
                  ],
                  "nice_to_have_skills": [
                    {"name": "", "importance": "preferred", "variants": []}
                  ],
                  "keywords": [],
                  "experience_requirements": {"total_years": 0}
                }

                Rules:
                - variants lists common alternative names of the skill (e.g. "Kubernetes": ["k8s", "EKS", "AKS"])
                - For "PostgreSQL": include ["postgres", "postgresql", "RDS Postgres", "Aurora PostgreSQL"]
                - For CI/CD: include ["CI/CD", "pipelines", "GitHub Actions", "Jenkins"] when mentioned
                """.formatted(jdText);
    }

    public static String evidenceGrade(String skillName, double minYears, String chunkText) {
        return """
                You are grading resume evidence for a job requirement.

                Skill: %s
                Minimum years required: %s

                Resume excerpt:
                %s

                Return ONLY JSON:
                {
                  "has_skill": true,
                  "evidence_strength": "strong|moderate|weak|none",
                  "years_supported": 0,
                  "meets_years": true,
                  "why": "one sentence",
                  "quote": "exact short quote from excerpt (<=25 words)",
                  "confidence": 0.0
                }

                Guidance:
                - strong: clearly used in work/projects/responsibilities
                - moderate: used but details limited
                - weak: just listed / mentioned
                - none: not supported by excerpt
                """.formatted(skillName, formatYears(minYears), chunkText);
    }

    public static String skillVariantMatch(String skillName, double minYears, Collection<String> resumeSkills) {
        return """
                Given a job requirement and a list of skills from a resume, determine which resume skills
                should count toward the requirement.

                Job Requirement: "%s" with %s+ years experience

                Available Resume Skills: %s

                Rules:
                1. If the requirement is GENERIC (e.g. ".NET", "React"), include ALL variants
                   - "React" requirement -> include: React, React.js, ReactJS
                2. If the requirement is SPECIFIC (e.g. ".NET 6", "React 18"), ONLY include that version
                3. If the requirement is a framework subset (e.g. "ASP.NET"), include that and related skills

                Return ONLY a JSON array of matching skill names:
                ["skill1", "skill2"]

                If no matches, return an empty array: []
                """.formatted(skillName, formatYears(minYears), String.join(", ", resumeSkills));
    }

    private static String formatYears(double years) {
        return years == Math.rint(years)
                ? String.valueOf((long) years)
                : String.format(Locale.ROOT, "%.1f", years);
    }
}
